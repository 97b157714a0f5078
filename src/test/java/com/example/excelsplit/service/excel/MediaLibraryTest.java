package com.example.excelsplit.service.excel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MediaLibraryTest {

    @TempDir
    Path tempDir;

    @Test
    void keepsRecognisedImagesByFileName() throws Exception {
        byte[] png = XlsxFixtures.png(4, 4);
        byte[] jpegHeader = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10, 'J', 'F', 'I', 'F'};
        Path file = XlsxFixtures.create()
                .sheet("<sheetData/>")
                .part("xl/media/image1.png", png)
                .part("xl/media/image2.jpeg", jpegHeader)
                .writeTo(tempDir, "media.xlsx");

        try (PackageArchive archive = PackageArchive.open(file)) {
            MediaLibrary media = MediaLibrary.scan(archive);

            assertEquals(2, media.size());
            assertEquals(ImageFormat.PNG, media.get("image1.png").orElseThrow().format());
            assertArrayEquals(png, media.get("image1.png").orElseThrow().data());
            assertEquals(ImageFormat.JPEG, media.get("image2.jpeg").orElseThrow().format());
            assertTrue(media.convertedImages().isEmpty());
            assertTrue(media.unsupportedImages().isEmpty());
        }
    }

    @Test
    void webpIsConvertedToPng() throws Exception {
        // 1x1 无损 WebP (VP8L)
        byte[] webp = Base64.getDecoder().decode("UklGRhoAAABXRUJQVlA4TA0AAAAvAAAAEAcQERGIiP4HAA==");
        Path file = XlsxFixtures.create()
                .sheet("<sheetData/>")
                .part("xl/media/x.webp", webp)
                .writeTo(tempDir, "webp.xlsx");

        try (PackageArchive archive = PackageArchive.open(file)) {
            MediaLibrary media = MediaLibrary.scan(archive);

            assertEquals(List.of("x.webp (WebP->PNG)"), media.convertedImages());
            assertTrue(media.unsupportedImages().isEmpty());
            MediaLibrary.MediaFile converted = media.get("x.webp").orElseThrow();
            assertEquals(ImageFormat.PNG, converted.format());
            byte[] pngMagic = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
            assertArrayEquals(pngMagic, Arrays.copyOf(converted.data(), pngMagic.length));
            assertEquals(1, ImageIO.read(new ByteArrayInputStream(converted.data())).getWidth());
        }
    }

    @Test
    void tinyEntriesAreSkippedSilently() throws Exception {
        Path file = XlsxFixtures.create()
                .sheet("<sheetData/>")
                .part("xl/media/tiny.png", new byte[]{(byte) 0x89, 'P', 'N', 'G'})
                .writeTo(tempDir, "tiny.xlsx");

        try (PackageArchive archive = PackageArchive.open(file)) {
            MediaLibrary media = MediaLibrary.scan(archive);

            assertTrue(media.isEmpty());
            assertTrue(media.unsupportedImages().isEmpty());
        }
    }

    @Test
    void undecodableFilesAreReportedAsUnsupported() throws Exception {
        byte[] brokenWebp = {'R', 'I', 'F', 'F', 12, 0, 0, 0, 'W', 'E', 'B', 'P', 'J', 'U', 'N', 'K'};
        Path file = XlsxFixtures.create()
                .sheet("<sheetData/>")
                .part("xl/media/image3.webp", brokenWebp)
                .part("xl/media/image4.emf", "not an image at all".getBytes(StandardCharsets.US_ASCII))
                .part("xl/worksheets/_rels/sheet1.xml.rels", XlsxFixtures.relationships())
                .writeTo(tempDir, "broken.xlsx");

        try (PackageArchive archive = PackageArchive.open(file)) {
            MediaLibrary media = MediaLibrary.scan(archive);

            assertTrue(media.isEmpty());
            assertTrue(media.convertedImages().isEmpty());
            assertEquals(2, media.unsupportedImages().size());
            assertTrue(media.unsupportedImages().contains("image3.webp"));
            assertTrue(media.unsupportedImages().contains("image4.emf"));
        }
    }

    @Test
    void recognisesMediaEntryLocations() {
        assertTrue(MediaLibrary.isMediaEntry("xl/media/image1.png"));
        assertTrue(MediaLibrary.isMediaEntry("xl/embeddings/oleObject1.bin"));
        assertTrue(MediaLibrary.isMediaEntry("word/media/image1.png"));
        assertFalse(MediaLibrary.isMediaEntry("xl/styles.xml"));
        assertEquals("image1.png", MediaLibrary.fileNameOf("../media/image1.png"));
        assertEquals("image1.png", MediaLibrary.fileNameOf("image1.png"));
    }
}

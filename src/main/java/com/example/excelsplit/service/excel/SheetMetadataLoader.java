package com.example.excelsplit.service.excel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 在同一个压缩包句柄上依次运行各子解析器，并把图片关联到单元格。
 */
@Slf4j
@Component
public class SheetMetadataLoader {

    public WorksheetMetadata load(PackageArchive archive) {
        // 工作表缺失直接失败，不再解析其他部件
        byte[] sheetXml = archive.read(PackageArchive.WORKSHEET_PART);

        StylesCatalog styles = archive.find(PackageArchive.STYLES_PART)
                .map(StylesCatalog::parse)
                .orElseGet(StylesCatalog::empty);
        MediaLibrary media = MediaLibrary.scan(archive);
        ImageReferenceGraph graph = ImageReferenceGraph.load(archive, media);

        WorksheetMetadata metadata = WorksheetMetadataParser.parse(sheetXml, styles);

        Map<CellCoordinate, EmbeddedImage> images = new HashMap<>();
        if (!media.isEmpty()) {
            linkFormulaImages(metadata, graph, images);
            linkFloatingImages(graph, images);
        }
        return metadata.withImages(images, media.convertedImages(), media.unsupportedImages());
    }

    private void linkFormulaImages(WorksheetMetadata metadata, ImageReferenceGraph graph,
                                   Map<CellCoordinate, EmbeddedImage> images) {
        int linked = 0;
        for (Map.Entry<CellCoordinate, String> entry : metadata.cellFormulas().entrySet()) {
            if (!ImageReferenceGraph.isImageDisplayFormula(entry.getValue())) {
                continue;
            }
            Optional<EmbeddedImage> image = graph.resolveFormulaImage(entry.getValue());
            if (image.isPresent()) {
                images.put(entry.getKey(), image.get());
                linked++;
            }
        }
        log.debug("关联 DISPIMG 图片: {} 个", linked);
    }

    private void linkFloatingImages(ImageReferenceGraph graph, Map<CellCoordinate, EmbeddedImage> images) {
        int linked = 0;
        for (ImageReferenceGraph.FloatingImage floating : graph.floatingImages()) {
            CellCoordinate coordinate = new CellCoordinate(floating.row(), floating.col());
            // 公式图片优先
            if (images.containsKey(coordinate)) {
                continue;
            }
            Optional<EmbeddedImage> image = graph.resolveFloatingImage(floating);
            if (image.isPresent()) {
                images.put(coordinate, image.get());
                linked++;
            }
        }
        log.debug("关联浮动图片: {} 个", linked);
    }
}

package com.example.excelsplit.service.excel;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 两套图片嵌入机制的引用关系：
 * <ul>
 *     <li>单元格图片（WPS）：cellimages.xml 中 图片ID -> rId，cellimages.xml.rels 中 rId -> 媒体文件；</li>
 *     <li>绘图层（drawing1.xml）：锚点给出 行/列 -> rId 的浮动图片，同时也带一份 图片ID -> rId 映射。</li>
 * </ul>
 * 图片ID 映射和 rId 映射都优先取单元格图片的，为空时回退到绘图层。
 */
@Slf4j
public final class ImageReferenceGraph {

    private static final Pattern DISPIMG_PATTERN = Pattern.compile("DISPIMG\\(\\s*\"([^\"]+)\"");
    private static final String DISPIMG = "DISPIMG";
    private static final String DRAWING_ID_PREFIX = "ID_";

    private final Map<String, String> idToRelationship;
    private final Map<String, String> relationshipToFile;
    private final Map<String, String> drawingRelationshipToFile;
    private final List<FloatingImage> floatingImages;
    private final MediaLibrary media;

    ImageReferenceGraph(Map<String, String> cellImageIds,
                        Map<String, String> cellImageRels,
                        Map<String, String> drawingIds,
                        Map<String, String> drawingRels,
                        List<FloatingImage> floatingImages,
                        MediaLibrary media) {
        this.idToRelationship = Collections.unmodifiableMap(cellImageIds.isEmpty() ? drawingIds : cellImageIds);
        this.relationshipToFile = Collections.unmodifiableMap(cellImageRels.isEmpty() ? drawingRels : cellImageRels);
        this.drawingRelationshipToFile = Collections.unmodifiableMap(drawingRels);
        this.floatingImages = List.copyOf(floatingImages);
        this.media = media;
    }

    public static ImageReferenceGraph load(PackageArchive archive, MediaLibrary media) {
        Map<String, String> cellImageIds = archive.find(PackageArchive.CELL_IMAGES_PART)
                .map(ImageReferenceGraph::parseCellImages)
                .orElse(Map.of());
        Map<String, String> cellImageRels = archive.find(PackageArchive.CELL_IMAGES_RELS_PART)
                .map(xml -> parseRelationships(PackageArchive.CELL_IMAGES_RELS_PART, xml))
                .orElse(Map.of());

        DrawingAnchors anchors = archive.find(PackageArchive.DRAWING_PART)
                .map(ImageReferenceGraph::parseDrawing)
                .orElse(new DrawingAnchors(Map.of(), List.of()));
        Map<String, String> drawingRels = archive.find(PackageArchive.DRAWING_RELS_PART)
                .map(xml -> parseRelationships(PackageArchive.DRAWING_RELS_PART, xml))
                .orElse(Map.of());

        log.debug("cellimages: {} 个ID映射, {} 个rId映射; drawing: {} 个ID映射, {} 个浮动图片, {} 个rId映射",
                cellImageIds.size(), cellImageRels.size(), anchors.idToRelationship().size(),
                anchors.floatingImages().size(), drawingRels.size());
        return new ImageReferenceGraph(cellImageIds, cellImageRels, anchors.idToRelationship(), drawingRels,
                anchors.floatingImages(), media);
    }

    public static boolean isImageDisplayFormula(String formula) {
        return formula != null && formula.contains(DISPIMG);
    }

    /**
     * 从形如 =DISPIMG("ID_xxx",1) 的公式中取出图片 ID。
     */
    public static Optional<String> extractImageId(String formula) {
        if (formula == null) {
            return Optional.empty();
        }
        Matcher matcher = DISPIMG_PATTERN.matcher(formula);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * 图片ID -> rId -> 文件名 -> 字节，任一环节缺失或字节不足 8 个时返回空。
     */
    public Optional<EmbeddedImage> resolveFormulaImage(String formula) {
        Optional<String> imageId = extractImageId(formula);
        if (imageId.isEmpty()) {
            return Optional.empty();
        }
        String relationshipId = idToRelationship.get(imageId.get());
        if (relationshipId == null) {
            return Optional.empty();
        }
        return resolveFile(relationshipToFile.get(relationshipId), imageId.get());
    }

    public List<FloatingImage> floatingImages() {
        return floatingImages;
    }

    public Optional<EmbeddedImage> resolveFloatingImage(FloatingImage floating) {
        String id = "floating_" + floating.row() + "_" + floating.col() + "_" + floating.relationshipId();
        return resolveFile(drawingRelationshipToFile.get(floating.relationshipId()), id);
    }

    private Optional<EmbeddedImage> resolveFile(String filename, String imageId) {
        if (filename == null) {
            return Optional.empty();
        }
        return media.get(filename)
                .map(file -> new EmbeddedImage(imageId, file.data(), file.format()))
                .filter(EmbeddedImage::hasUsableData);
    }

    static Map<String, String> parseCellImages(byte[] xml) {
        Map<String, String> ids = new HashMap<>();
        AnchorState state = new AnchorState();
        XmlPartScanner.forPart(PackageArchive.CELL_IMAGES_PART)
                .onStart("cellImage", e -> state.reset())
                .onStart("cNvPr", e -> {
                    if (e.within("cellImage")) {
                        state.name = e.attribute("name");
                    }
                })
                .onStart("blip", e -> {
                    if (e.within("cellImage")) {
                        state.embed = e.attribute("embed");
                    }
                })
                .onEnd("cellImage", e -> {
                    if (state.name != null && state.embed != null) {
                        ids.put(state.name, state.embed);
                    }
                    state.reset();
                })
                .scan(xml);
        return ids;
    }

    static DrawingAnchors parseDrawing(byte[] xml) {
        Map<String, String> ids = new HashMap<>();
        List<FloatingImage> floating = new ArrayList<>();
        AnchorState state = new AnchorState();
        XmlPartScanner scanner = XmlPartScanner.forPart(PackageArchive.DRAWING_PART)
                .onText("row", (e, text) -> {
                    if (e.hasParent("from")) {
                        state.row = parseIndex(text);
                    }
                })
                .onText("col", (e, text) -> {
                    if (e.hasParent("from")) {
                        state.col = parseIndex(text);
                    }
                })
                .onStart("cNvPr", e -> {
                    if (e.within("pic")) {
                        state.name = e.attribute("name");
                    }
                })
                .onStart("blip", e -> {
                    if (e.within("pic")) {
                        state.embed = e.attribute("embed");
                    }
                });
        for (String anchor : List.of("twoCellAnchor", "oneCellAnchor")) {
            scanner.onStart(anchor, e -> state.reset())
                    .onEnd(anchor, e -> {
                        if (state.row != null && state.col != null && state.embed != null) {
                            floating.add(new FloatingImage(state.row, state.col, state.embed));
                        }
                        if (state.name != null && state.embed != null && state.name.startsWith(DRAWING_ID_PREFIX)) {
                            ids.put(state.name, state.embed);
                        }
                        state.reset();
                    });
        }
        scanner.scan(xml);
        return new DrawingAnchors(ids, floating);
    }

    /**
     * 解析 .rels 文件，返回 rId -> 目标文件名（只保留路径最后一段）。
     */
    static Map<String, String> parseRelationships(String partName, byte[] xml) {
        Map<String, String> relationships = new HashMap<>();
        XmlPartScanner.forPart(partName)
                .onStart("Relationship", e -> {
                    String id = e.attribute("Id");
                    String target = e.attribute("Target");
                    if (id != null && target != null) {
                        relationships.put(id, MediaLibrary.fileNameOf(target));
                    }
                })
                .scan(xml);
        return relationships;
    }

    private static Integer parseIndex(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 绘图层锚点左上角所在单元格（从 0 开始）及其引用的 rId。
     */
    public record FloatingImage(int row, int col, String relationshipId) {
    }

    record DrawingAnchors(Map<String, String> idToRelationship, List<FloatingImage> floatingImages) {
    }

    private static final class AnchorState {
        private String name;
        private String embed;
        private Integer row;
        private Integer col;

        private void reset() {
            name = null;
            embed = null;
            row = null;
            col = null;
        }
    }
}

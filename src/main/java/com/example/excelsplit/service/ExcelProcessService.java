package com.example.excelsplit.service;

import com.example.excelsplit.service.excel.ExcelFileException;
import com.example.excelsplit.service.excel.ExcelValidationException;
import com.example.excelsplit.service.excel.PackageArchive;
import com.example.excelsplit.service.excel.PoiCellValueReader;
import com.example.excelsplit.service.excel.SheetMetadataLoader;
import com.example.excelsplit.service.excel.SheetTransformer;
import com.example.excelsplit.service.excel.StyledCellValue;
import com.example.excelsplit.service.excel.WorkbookWriter;
import com.example.excelsplit.service.excel.WorksheetMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 拆分表处理入口：读取源文件元数据与原始值，按配置转换后写出 {@code <文件名>_拆分表.<扩展名>}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExcelProcessService {

    static final String OUTPUT_SUFFIX = "_拆分表";
    private static final String DEFAULT_EXTENSION = "xlsx";

    private final SheetMetadataLoader metadataLoader;
    private final SheetTransformer transformer;
    private final WorkbookWriter writer;

    public ProcessResponse process(ProcessRequest request) {
        if (request == null || request.filePath() == null || request.filePath().isBlank()) {
            throw new ExcelValidationException("文件路径不能为空");
        }
        if (request.config() == null) {
            throw new ExcelValidationException("处理配置不能为空");
        }
        ProcessConfig config = request.config();
        config.validate();

        Path input = toPath(request.filePath());
        if (!Files.isRegularFile(input)) {
            throw new ExcelFileException("文件不存在: " + request.filePath());
        }

        List<String> logs = new ArrayList<>();
        logs.add("开始处理文件: " + request.filePath());
        logs.add("处理类型: " + config.processType());
        log.info("开始处理文件 {}，类型 {}", input, config.processType());

        List<List<StyledCellValue>> grid;
        WorksheetMetadata metadata;
        try (PoiCellValueReader reader = PoiCellValueReader.open(input)) {
            logs.add("成功打开 Excel 文件");
            logs.add(String.format("读取工作表，共 %d 行 %d 列", reader.rowCount(), reader.colCount()));

            try (PackageArchive archive = PackageArchive.open(input)) {
                metadata = metadataLoader.load(archive);
            }
            appendMetadataLogs(metadata, logs);

            grid = transformer.transform(reader, metadata, config, logs);
        }

        Path output = resolveOutputPath(input);
        logs.add("输出文件路径: " + output);

        writer.write(grid, metadata, output, logs);
        logs.add("成功写入处理后的文件");
        log.info("处理完成 {} -> {}，共 {} 行", input, output, grid.size());

        return new ProcessResponse(true, output.toString(), "处理完成", logs);
    }

    private void appendMetadataLogs(WorksheetMetadata metadata, List<String> logs) {
        logs.add(String.format("检测到 %d 个合并单元格区域", metadata.mergedRegions().size()));
        if (!metadata.cellImages().isEmpty()) {
            logs.add(String.format("检测到 %d 个图片", metadata.cellImages().size()));
        }
        if (!metadata.convertedImages().isEmpty()) {
            logs.add(String.format("✓ 自动转换了 %d 个图片格式: %s",
                    metadata.convertedImages().size(), String.join(", ", metadata.convertedImages())));
        }
        if (!metadata.unsupportedImages().isEmpty()) {
            logs.add(String.format("⚠️ 跳过 %d 个无法处理的图片: %s",
                    metadata.unsupportedImages().size(), String.join(", ", metadata.unsupportedImages())));
        }
    }

    static Path resolveOutputPath(Path input) {
        Path parent = input.toAbsolutePath().getParent();
        if (parent == null) {
            throw new ExcelFileException("无法获取文件目录: " + input);
        }
        Path fileName = input.getFileName();
        if (fileName == null) {
            throw new ExcelFileException("无法获取文件名: " + input);
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1) : DEFAULT_EXTENSION;
        if (stem.isEmpty()) {
            throw new ExcelFileException("无法获取文件名: " + input);
        }
        String outputName = stem + OUTPUT_SUFFIX + "." + extension;
        try {
            return parent.resolve(outputName);
        } catch (InvalidPathException e) {
            // 文件系统编码无法表示输出文件名
            throw new ExcelFileException("无法生成输出文件路径: " + outputName, e);
        }
    }

    private static Path toPath(String filePath) {
        try {
            return Paths.get(filePath);
        } catch (InvalidPathException e) {
            throw new ExcelFileException("文件路径无效: " + filePath, e);
        }
    }
}

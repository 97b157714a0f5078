package com.example.excelsplit.service.excel;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 源工作表的原始单元格值，坐标从 0 开始。只暴露值，不含样式、合并区域等展示信息。
 */
public interface CellValueReader {

    Optional<String> getString(int row, int col);

    OptionalDouble getFloat(int row, int col);

    int rowCount();

    int colCount();

    boolean isEmpty(int row, int col);
}

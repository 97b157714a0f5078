package com.example.excelsplit.service;

import com.example.excelsplit.service.excel.ExcelValidationException;

/**
 * 处理配置。列号从 1 开始，与 Excel 界面上看到的列序一致。
 *
 * @param processType  处理类型
 * @param weightColumn 重量列（海铁 13，空运 15），其前一列为数量列
 * @param boxColumn    箱数列（海铁 11，空运 13）
 * @param copyImages   是否把源文件中的图片复制到输出
 */
public record ProcessConfig(
        ProcessType processType,
        int weightColumn,
        int boxColumn,
        boolean copyImages
) {

    public static ProcessConfig defaultFor(ProcessType type) {
        return switch (type) {
            case SEA_RAIL_WITH_IMAGE -> new ProcessConfig(type, 13, 11, true);
            case SEA_RAIL_NO_IMAGE -> new ProcessConfig(type, 13, 11, false);
            case AIR_FREIGHT -> new ProcessConfig(type, 15, 13, true);
        };
    }

    public int weightColumnIndex() {
        return weightColumn - 1;
    }

    public int boxColumnIndex() {
        return boxColumn - 1;
    }

    public void validate() {
        if (processType == null) {
            throw new ExcelValidationException("处理类型不能为空");
        }
        // 数量列固定为重量列的前一列，所以重量列至少是第 2 列
        if (weightColumn < 2) {
            throw new ExcelValidationException("重量列必须从第 2 列开始，当前为: " + weightColumn);
        }
        if (boxColumn < 1) {
            throw new ExcelValidationException("箱数列必须为正数，当前为: " + boxColumn);
        }
        if (weightColumn == boxColumn) {
            throw new ExcelValidationException("重量列与箱数列不能相同: " + weightColumn);
        }
    }
}

package com.ktast.parser;

/**
 * 解析配置
 */
public class ParserConfig {
    private String fileName = "<source>";
    private boolean failOnError = true;
    private boolean collapseBlankLines = false;

    public ParserConfig() {
    }

    /**
     * 用于错误信息和日志的文件名
     */
    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    /**
     * 有语法错误时是否抛出 {@link ParseFailedException}；为 false 时出错的部分被跳过
     */
    public boolean isFailOnError() {
        return failOnError;
    }

    public void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    /**
     * 是否把连续空行折叠为空行计数，开启后输出不再与源码逐字节相同
     */
    public boolean isCollapseBlankLines() {
        return collapseBlankLines;
    }

    public void setCollapseBlankLines(boolean collapseBlankLines) {
        this.collapseBlankLines = collapseBlankLines;
    }
}

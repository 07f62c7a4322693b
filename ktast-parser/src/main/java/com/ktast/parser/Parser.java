package com.ktast.parser;

import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.KotlinScript;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 解析入口：源码 → 原始语法树 → 语法树节点
 *
 * <pre>
 * Parsed&lt;KotlinFile&gt; parsed = new Parser().parseFileWithExtras(source);
 * String same = Writer.write(parsed.getRoot(), parsed.getExtrasMap());
 * </pre>
 */
public class Parser {

    private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());

    private final ParserConfig config;

    public Parser() {
        this(new ParserConfig());
    }

    public Parser(ParserConfig config) {
        this.config = config;
    }

    public ParserConfig getConfig() {
        return config;
    }

    /**
     * 只做语法分析，不转换也不因错误抛出异常
     */
    public ParseResult parseRaw(String source, boolean script) {
        KotlinParser parser = new KotlinParser(source, config.getFileName());
        return script ? parser.parseScript() : parser.parseFile();
    }

    // ============ 文件 ============

    public KotlinFile parseFile(String source) {
        return parseFile(source, new Converter());
    }

    public KotlinFile parseFile(String source, Converter converter) {
        return converter.convertFile(checked(parseRaw(source, false)).getRoot());
    }

    public Parsed<KotlinFile> parseFileWithExtras(String source) {
        ConverterWithExtras converter = new ConverterWithExtras(config.isCollapseBlankLines());
        KotlinFile file = parseFile(source, converter);
        return new Parsed<KotlinFile>(file, converter.getExtrasMap());
    }

    // ============ 脚本 ============

    public KotlinScript parseScript(String source) {
        return parseScript(source, new Converter());
    }

    public KotlinScript parseScript(String source, Converter converter) {
        return converter.convertScript(checked(parseRaw(source, true)).getRoot());
    }

    public Parsed<KotlinScript> parseScriptWithExtras(String source) {
        ConverterWithExtras converter = new ConverterWithExtras(config.isCollapseBlankLines());
        KotlinScript script = parseScript(source, converter);
        return new Parsed<KotlinScript>(script, converter.getExtrasMap());
    }

    private ParseResult checked(ParseResult result) {
        if (result.hasErrors()) {
            if (config.isFailOnError()) {
                throw new ParseFailedException(config.getFileName(), result.getErrors());
            }
            LOGGER.log(Level.FINE, "{0}: skipping {1} erroneous elements",
                    new Object[]{config.getFileName(), result.getErrors().size()});
        } else {
            LOGGER.log(Level.FINE, "{0}: parsed without errors", config.getFileName());
        }
        return result;
    }
}

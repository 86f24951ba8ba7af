package com.signalmix.utils;

import org.jsoup.Jsoup;

import java.util.regex.Pattern;

/**
 * 模块说明：TextFormatter（class）。
 * 主要职责：把新闻标题中的 HTML 标签与实体转为纯文本，并提供报表单行截断。
 * 使用建议：只用于展示与 enrichment 结果，不要用它处理 CSV 原始单元格。
 */
public class TextFormatter {
    public static final String ELLIPSIS = "…";

    private static final Pattern LINE_BREAKS = Pattern.compile("[\r\n]+");
    private static final Pattern MULTI_SPACE = Pattern.compile("[ \t ]{2,}");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\n\t]]");

    public static String toPlainText(String s) {
        if (s == null) {
            return "";
        }
        // 标题里常见 <b>、&amp; 之类的残留，交给 jsoup 解码
        String t = Jsoup.parse(s).text();
        t = CONTROL_CHARS.matcher(t).replaceAll("");
        return singleLine(t);
    }

    // 规则：换行合并为空格，多个空白压成一个
    public static String singleLine(String s) {
        if (s == null) {
            return "";
        }
        String t = LINE_BREAKS.matcher(s).replaceAll(" ");
        t = MULTI_SPACE.matcher(t).replaceAll(" ");
        return t.trim();
    }

    public static String truncate(String s, int maxChars) {
        String t = singleLine(s);
        if (maxChars <= 0 || t.length() <= maxChars) {
            return t;
        }
        if (maxChars == 1) {
            return ELLIPSIS;
        }
        return t.substring(0, maxChars - 1).trim() + ELLIPSIS;
    }
}

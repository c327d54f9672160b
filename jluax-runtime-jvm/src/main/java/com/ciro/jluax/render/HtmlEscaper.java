package com.ciro.jluax.render;

public final class HtmlEscaper {

    private HtmlEscaper() {}

    public static void text(CharSequence s, StringBuilder out) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                default -> out.append(c);
            }
        }
    }

    // Los valores siempre van entre comillas dobles, pero escapamos ambas
    public static void attribute(CharSequence s, StringBuilder out) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
    }

    public static String text(CharSequence s) {
        StringBuilder sb = new StringBuilder(s.length() + 16);
        text(s, sb);
        return sb.toString();
    }
}

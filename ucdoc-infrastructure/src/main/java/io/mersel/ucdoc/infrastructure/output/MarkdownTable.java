package io.mersel.ucdoc.infrastructure.output;

import java.util.List;

/**
 * Markdown tablo yardımcıları.
 */
final class MarkdownTable {

    private MarkdownTable() {
    }

    static String row(List<String> cells) {
        StringBuilder sb = new StringBuilder("|");
        for (String cell : cells) {
            sb.append(' ').append(escape(cell)).append(" |");
        }
        return sb.append('\n').toString();
    }

    static String separator(int columns) {
        return "|" + " --- |".repeat(columns) + "\n";
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.strip().replace("|", "\\|").replace("\r\n", "<br>").replace("\n", "<br>");
    }
}

package com.delta.notifier.source;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns GitHub-flavoured pipe tables into HTML tables so that one jsoup code path reads
 * both shapes of the listing document. Inline HTML already present in cells is kept;
 * markdown links and bold text are rewritten to their HTML equivalents.
 */
final class MarkdownTables {
    private static final Pattern SEPARATOR_ROW = Pattern.compile("^\\|?\\s*:?-{3,}:?\\s*(\\|\\s*:?-{3,}:?\\s*)*\\|?$");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]*)\\]\\(([^)\\s]+)\\)");
    private static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*");

    private MarkdownTables() {
    }

    static String toHtml(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        StringBuilder html = new StringBuilder("<html><body>");
        List<String> block = new ArrayList<>();
        for (String rawLine : markdown.split("\\R")) {
            String line = rawLine.trim();
            if (line.startsWith("|")) {
                block.add(line);
                continue;
            }
            appendTable(block, html);
            block.clear();
        }
        appendTable(block, html);
        html.append("</body></html>");
        return html.toString();
    }

    private static void appendTable(List<String> lines, StringBuilder html) {
        if (lines.size() < 2 || !SEPARATOR_ROW.matcher(lines.get(1)).matches()) {
            return;
        }
        html.append("<table><thead><tr>");
        for (String header : splitRow(lines.get(0))) {
            html.append("<th>").append(inline(header)).append("</th>");
        }
        html.append("</tr></thead><tbody>");
        for (int i = 2; i < lines.size(); i++) {
            html.append("<tr>");
            for (String cell : splitRow(lines.get(i))) {
                html.append("<td>").append(inline(cell)).append("</td>");
            }
            html.append("</tr>");
        }
        html.append("</tbody></table>\n");
    }

    static List<String> splitRow(String line) {
        String body = line.trim();
        if (body.startsWith("|")) {
            body = body.substring(1);
        }
        if (body.endsWith("|") && !body.endsWith("\\|")) {
            body = body.substring(0, body.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length() && body.charAt(i + 1) == '|') {
                current.append('|');
                i++;
            } else if (c == '|') {
                cells.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString().trim());
        return cells;
    }

    private static String inline(String cell) {
        Matcher link = LINK.matcher(cell);
        String withLinks = link.replaceAll(match ->
            Matcher.quoteReplacement("<a href=\"" + match.group(2) + "\">" + match.group(1) + "</a>"));
        return BOLD.matcher(withLinks).replaceAll("<strong>$1</strong>");
    }
}

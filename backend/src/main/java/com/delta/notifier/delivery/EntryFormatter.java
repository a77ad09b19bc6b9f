package com.delta.notifier.delivery;

import com.delta.notifier.model.Entry;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders entries as MarkdownV2 text blocks. Each block ends with a blank line so that
 * blocks can be concatenated into a batch as-is.
 */
@Component
public class EntryFormatter {
    private static final String MISSING = "N/A";
    private static final String MARKDOWN_SPECIALS = "\\_*[]()~`>#+-=|{}.!";
    private static final DateTimeFormatter POSTED_FORMAT = DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.US);

    public String format(Entry entry, boolean includeApplicationLink) {
        List<String> lines = new ArrayList<>();
        lines.add("*Company*: " + escape(valueOrMissing(entry.organization())));
        lines.add("*Role*: " + escape(valueOrMissing(entry.role())));
        lines.add("*Location*: " + escape(valueOrMissing(entry.location())));
        String posted = entry.postedDate() == null ? MISSING : POSTED_FORMAT.format(entry.postedDate());
        lines.add("*Date Posted*: " + escape(posted));
        if (entry.link() != null) {
            lines.add("[Link](" + escapeUrl(entry.link()) + ")");
        }
        if (includeApplicationLink && entry.applicationLink() != null) {
            lines.add("[Application](" + escapeUrl(entry.applicationLink()) + ")");
        }
        return String.join("\n", lines) + "\n\n";
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (MARKDOWN_SPECIALS.indexOf(c) >= 0) {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    // inside a link target only ')' and '\' are significant
    static String escapeUrl(String url) {
        return url.replace("\\", "\\\\").replace(")", "\\)");
    }

    private String valueOrMissing(String value) {
        return value == null || value.isBlank() ? MISSING : value;
    }
}

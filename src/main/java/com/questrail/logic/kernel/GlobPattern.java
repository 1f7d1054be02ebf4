package com.questrail.logic.kernel;

import java.util.regex.Pattern;

/**
 * Shell-style wildcard matching of block names: {@code *}, {@code ?},
 * {@code [seq]} and {@code [!seq]}.
 */
final class GlobPattern {

    private final Pattern regex;

    private GlobPattern(Pattern regex) {
        this.regex = regex;
    }

    static boolean isGlob(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0 || text.indexOf('[') >= 0;
    }

    static GlobPattern compile(String glob) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i++);
            if (c == '*') {
                sb.append(".*");
            } else if (c == '?') {
                sb.append('.');
            } else if (c == '[') {
                int close = glob.indexOf(']', i + 1);
                if (close < 0) {
                    sb.append("\\[");
                    continue;
                }
                String set = glob.substring(i, close);
                i = close + 1;
                sb.append('[');
                if (set.startsWith("!")) {
                    sb.append('^');
                    set = set.substring(1);
                }
                sb.append(set.replace("\\", "\\\\").replace("[", "\\[").replace("^", "\\^"));
                sb.append(']');
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return new GlobPattern(Pattern.compile(sb.toString(), Pattern.DOTALL));
    }

    boolean matches(String name) {
        return regex.matcher(name).matches();
    }
}

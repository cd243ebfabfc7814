package com.jsgf.tools.parser;

/**
 * Blanks out {@code //} line comments and {@code /* ... *}{@code /} block comments one
 * line at a time. Comment characters are replaced by spaces so token columns are
 * unchanged; block comments may span lines.
 */
public class CommentStripper {

    private boolean inBlockComment;

    public String strip(String line) {
        StringBuilder sb = new StringBuilder(line.length());
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            char next = i + 1 < line.length() ? line.charAt(i + 1) : '\0';

            if (inBlockComment) {
                if (c == '*' && next == '/') {
                    inBlockComment = false;
                    sb.append("  ");
                    i += 2;
                } else {
                    sb.append(' ');
                    i++;
                }
            } else if (c == '/' && next == '/') {
                break;
            } else if (c == '/' && next == '*') {
                inBlockComment = true;
                sb.append("  ");
                i += 2;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    public boolean isInBlockComment() {
        return inBlockComment;
    }
}

package com.pipeduck.ppl.ast;

/**
 * {@code head [n] [from offset]}.
 *
 * @param size the row count, or null for the configured default
 * @param offset the rows to skip
 */
public record HeadCommand(Long size, long offset) implements PPLCommand {

    @Override
    public String canonicalText() {
        StringBuilder sb = new StringBuilder("head");
        if (size != null) {
            sb.append(' ').append(size);
        }
        if (offset != 0) {
            sb.append(" from ").append(offset);
        }
        return sb.toString();
    }
}

package xyz.jphil.imgpdf.tools.pdf;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Inclusive, 1-based page range. Lists of ranges keep the order they were given in;
 * overlaps and repeats are allowed and produce repeated pages.
 */
public record PageRange(int start, int end) {

    private static final Pattern RANGE_PATTERN = Pattern.compile("\\s*(\\d+)\\s*(?:-\\s*(\\d+)\\s*)?");

    public int length() {
        return end - start + 1;
    }

    /**
     * Checks this range against a document of {@code totalPages} pages.
     *
     * @param index 1-based position in the range list, used in the message
     */
    public void validate(int index, int totalPages) {
        if (start < 1 || end < 1) {
            throw new IllegalArgumentException(String.format("Range %d: Page numbers must be positive.", index));
        }
        if (start > totalPages || end > totalPages) {
            throw new IllegalArgumentException(String.format("Range %d: Page numbers cannot exceed %d.", index, totalPages));
        }
        if (start > end) {
            throw new IllegalArgumentException(String.format("Range %d: Start page cannot be greater than end page.", index));
        }
    }

    /**
     * Parses "1-3, 7, 2-2". A bare number is a single page.
     */
    public static List<PageRange> parseList(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Please add at least one page range.");
        }
        var tokens = text.split(",", -1);
        List<PageRange> ranges = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            var m = RANGE_PATTERN.matcher(tokens[i]);
            if (!m.matches()) {
                throw new IllegalArgumentException(String.format(
                    "Range %d: Please enter valid page numbers ('%s').", i + 1, tokens[i].trim()));
            }
            try {
                int start = Integer.parseInt(m.group(1));
                int end = m.group(2) != null ? Integer.parseInt(m.group(2)) : start;
                ranges.add(new PageRange(start, end));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format(
                    "Range %d: Please enter valid page numbers ('%s').", i + 1, tokens[i].trim()));
            }
        }
        return ranges;
    }

    public static void validateAll(List<PageRange> ranges, int totalPages) {
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("Please add at least one page range.");
        }
        for (int i = 0; i < ranges.size(); i++) {
            ranges.get(i).validate(i + 1, totalPages);
        }
    }

    public static int totalPages(List<PageRange> ranges) {
        return ranges.stream().mapToInt(PageRange::length).sum();
    }

    public static String summary(List<PageRange> ranges) {
        return String.join(", ", ranges.stream().map(PageRange::toString).toList());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}

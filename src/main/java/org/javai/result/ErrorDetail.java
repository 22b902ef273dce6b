package org.javai.result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered, immutable sequence of (category, message) entries describing a failure.
 *
 * <p>Insertion order is significant: the first entry is usually the primary {@code "error"}
 * and later entries annotate it. Adding an entry returns a new instance and leaves the
 * original untouched.
 *
 * <pre>{@code
 * ErrorDetail detail = ErrorDetail.of("connection refused")
 *     .add("warning", "retrying with backup host")
 *     .add("info", "backup host is read-only");
 * }</pre>
 *
 * @param entries the entries in insertion order
 */
public record ErrorDetail(List<Entry> entries) {

    /**
     * The category used for primary error messages.
     */
    public static final String ERROR_CATEGORY = "error";

    private static final ErrorDetail EMPTY = new ErrorDetail(List.of());

    /**
     * A single (category, message) pair.
     *
     * @param category the kind of entry, e.g. "error", "warning", "info"
     * @param message human-readable text
     */
    public record Entry(String category, String message) {

        public Entry {
            Objects.requireNonNull(category, "category must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }

        /**
         * Creates an entry in the {@value ErrorDetail#ERROR_CATEGORY} category.
         */
        public static Entry error(String message) {
            return new Entry(ERROR_CATEGORY, message);
        }

        @Override
        public String toString() {
            return "(" + category + ", " + message + ")";
        }
    }

    public ErrorDetail {
        Objects.requireNonNull(entries, "entries must not be null");
        entries = List.copyOf(entries);
    }

    public static ErrorDetail empty() {
        return EMPTY;
    }

    /**
     * Creates a detail holding one {@value #ERROR_CATEGORY} entry.
     */
    public static ErrorDetail of(String message) {
        return new ErrorDetail(List.of(Entry.error(message)));
    }

    public static ErrorDetail of(Entry... entries) {
        return new ErrorDetail(Arrays.asList(entries));
    }

    /**
     * Creates a detail from an exception's message. A null exception or a null message
     * yields an empty message.
     */
    public static ErrorDetail fromThrowable(Throwable throwable) {
        String message = throwable == null ? null : throwable.getMessage();
        return of(message == null ? "" : message);
    }

    /**
     * Returns a new detail with the entry appended.
     *
     * @param category the entry's category
     * @param message the entry's message
     * @return a new detail, this one is not modified
     */
    public ErrorDetail add(String category, String message) {
        List<Entry> appended = new ArrayList<>(entries.size() + 1);
        appended.addAll(entries);
        appended.add(new Entry(category, message));
        return new ErrorDetail(appended);
    }

    /**
     * Returns a new detail with all of {@code other}'s entries appended after this one's.
     */
    public ErrorDetail addAll(ErrorDetail other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other.isEmpty()) {
            return this;
        }
        List<Entry> appended = new ArrayList<>(entries.size() + other.size());
        appended.addAll(entries);
        appended.addAll(other.entries);
        return new ErrorDetail(appended);
    }

    public Optional<Entry> first() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0));
    }

    public List<String> messages() {
        return entries.stream().map(Entry::message).toList();
    }

    public boolean contains(Entry entry) {
        return entries.contains(entry);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}

package personal.salon.reservation.booking.domain.model;

/**
 * Pagination (0-based page)
 */
public record Pagination(int page, int size) {

    public static final int MAX_SIZE = 100;

    public Pagination {
        if (page < 0) {
            throw new IllegalArgumentException("Page cannot be negative: " + page);
        }
        if (size < 1 || size > MAX_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_SIZE + ": " + size);
        }
    }
}

package personal.salon.reservation.booking.domain.model;

import java.util.List;
import java.util.function.Function;

/**
 * Page Result
 */
public record PageResult<T>(
        List<T> items,
        long totalElements,
        int page,
        int size
) {
    public PageResult {
        items = List.copyOf(items);
    }

    public int totalPages() {
        return size == 0 ? 0 : (int) ((totalElements + size - 1) / size);
    }

    public <U> PageResult<U> map(Function<? super T, ? extends U> mapper) {
        List<U> mapped = items.stream().<U>map(mapper).toList();
        return new PageResult<>(mapped, totalElements, page, size);
    }
}

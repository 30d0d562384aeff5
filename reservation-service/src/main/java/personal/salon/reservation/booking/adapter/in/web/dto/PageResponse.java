package personal.salon.reservation.booking.adapter.in.web.dto;

import personal.salon.reservation.booking.domain.model.PageResult;

import java.util.List;
import java.util.function.Function;

/**
 * 페이지 응답 DTO
 */
public record PageResponse<T>(
        List<T> items,
        long totalElements,
        int totalPages,
        int page,
        int size
) {
    public static <S, T> PageResponse<T> from(PageResult<S> result, Function<S, T> mapper) {
        PageResult<T> mapped = result.map(mapper);
        return new PageResponse<>(mapped.items(), mapped.totalElements(), mapped.totalPages(),
                mapped.page(), mapped.size());
    }
}

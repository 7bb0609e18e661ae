package dustin.referral.shared.model.dto;

import java.util.Collections;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 페이징 응답 DTO
 * Page Response DTO
 * 
 * Spring Page를 API 응답 형태로 감싸는 래퍼
 * 
 * 사용 예시:
 * ```java
 * // 여러 원장(커미션 + 캐시백)을 합쳐 정렬한 뒤 잘라서 반환
 * PageResponse<EarningsHistoryItem> response = PageResponse.slice(merged, page, size);
 * ```
 * 
 * @param <T> 항목 타입 (DTO)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {

    /**
     * 현재 페이지 항목
     */
    private List<T> content;

    /**
     * 페이지 번호 (0부터 시작)
     */
    private int page;

    private int size;

    private long totalElements;

    private int totalPages;

    private boolean first;

    private boolean last;

    /**
     * 다음 페이지 존재 여부
     */
    private boolean hasMore;

    public static <T> PageResponse<T> of(Page<?> page, List<T> content) {
        return PageResponse.<T>builder()
                .content(content)
                .page(page.getNumber())
                .size(page.getSize())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .first(page.isFirst())
                .last(page.isLast())
                .hasMore(page.hasNext())
                .build();
    }

    /**
     * 이미 정렬된 전체 목록에서 한 페이지를 잘라 반환
     * 
     * @param sorted 정렬된 전체 목록
     * @param page 페이지 번호 (0부터)
     * @param size 페이지 크기 (1 이상)
     */
    public static <T> PageResponse<T> slice(List<T> sorted, int page, int size) {
        int from = (int) Math.min((long) page * size, sorted.size());
        int to = Math.min(from + size, sorted.size());
        List<T> content = from < to ? sorted.subList(from, to) : Collections.emptyList();
        Page<T> result = new PageImpl<>(content, PageRequest.of(page, size), sorted.size());
        return of(result, content);
    }
}

package cn.bitsleep.recipebook.web.dto;

import cn.bitsleep.recipebook.domain.Recipe;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.data.domain.Page;

import java.util.List;

@Getter
@AllArgsConstructor
public class PaginationDto {
    private List<RecipeDto> items;
    private int page;          // 1-based
    private int itemsPerPage;
    private long totalItems;
    private int totalPages;

    public static PaginationDto from(Page<Recipe> page) {
        return new PaginationDto(
                page.getContent().stream().map(RecipeDto::from).toList(),
                page.getNumber() + 1,
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages());
    }
}

package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.CategoryType;

import java.util.List;
import java.util.UUID;

public record CategorySpec(
        UUID categoryId,
        String name,
        boolean main,
        boolean active,
        int orderIdx,
        CategoryType categoryType,
        CriteriaSet criteria,
        List<PrizeSpec> prizes
) {

    public CategorySpec {
        categoryType = categoryType == null ? CategoryType.CRITERIA : categoryType;
        criteria = criteria == null ? CriteriaSet.UNCONSTRAINED : criteria;
        prizes = prizes == null ? List.of() : List.copyOf(prizes);
    }
}

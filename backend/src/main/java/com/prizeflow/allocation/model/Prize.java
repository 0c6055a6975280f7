package com.prizeflow.allocation.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "prizes")
public class Prize {

    @Id
    @Column(name = "prize_id", nullable = false, updatable = false)
    private UUID prizeId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "place", nullable = false)
    private Integer place;

    @Column(name = "cash_amount", precision = 12, scale = 2)
    private BigDecimal cashAmount;

    @Column(name = "has_trophy", nullable = false)
    private boolean trophy = false;

    @Column(name = "has_medal", nullable = false)
    private boolean medal = false;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}

package com.prizeflow.allocation.engine;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * One line of the audit comparison between the automatic and the committed winner.
 */
public record RcaRow(
        UUID categoryId,
        String categoryName,
        boolean mainCategory,
        UUID prizeId,
        int place,
        String prizeLabel,
        BigDecimal cashAmount,
        UUID engineWinnerId,
        String engineWinnerName,
        Integer engineWinnerRank,
        Integer engineWinnerRating,
        UUID finalWinnerId,
        String finalWinnerName,
        Integer finalWinnerRank,
        Integer finalWinnerRating,
        RcaStatus status,
        String overrideReason,
        ReasonCode reasonCode,
        String reasonLabel,
        String diagnosisSummary,
        List<String> failCodes,
        boolean unfilled,
        boolean blockedByOnePrize,
        int candidatesBeforeOnePrize,
        int candidatesAfterOnePrize
) {
}

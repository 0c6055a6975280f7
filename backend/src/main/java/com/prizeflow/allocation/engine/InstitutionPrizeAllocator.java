package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.Gender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Ranks institutions (clubs, cities, states or import labels) by the combined score
 * of their best team and hands out each group's prizes in place order.
 *
 * <p>A competitor scores {@code maxRank + 1 - rank} points, so the tournament winner
 * scores highest. Teams fill their female slots first, then their male slots (any
 * competitor not recorded as female), then the remaining seats with the best players
 * left. Team prizes sit outside the individual one-prize rule: a competitor may win
 * an individual prize and help their institution to a team prize.
 */
@Component
public class InstitutionPrizeAllocator {

    private static final Logger log = LoggerFactory.getLogger(InstitutionPrizeAllocator.class);

    static final int MAX_INELIGIBLE_REASONS = 10;

    private static final Map<String, Function<CompetitorProfile, String>> GROUP_BY_FIELDS = Map.of(
            "club", CompetitorProfile::club,
            "city", CompetitorProfile::city,
            "state", CompetitorProfile::state,
            "group_label", CompetitorProfile::groupLabel,
            "type_label", CompetitorProfile::typeLabel
    );

    private static final Comparator<InstitutionStanding.TeamMember> BY_SCORE = Comparator
            .comparingInt(InstitutionStanding.TeamMember::points).reversed()
            .thenComparingInt(InstitutionStanding.TeamMember::rank);

    static final Comparator<InstitutionStanding> STANDING_ORDER = Comparator
            .comparingInt(InstitutionStanding::totalPoints).reversed()
            .thenComparingInt(InstitutionStanding::rankSum)
            .thenComparingInt(InstitutionStanding::bestIndividualRank)
            .thenComparing(InstitutionStanding::key);

    public InstitutionAllocation allocate(List<CompetitorProfile> competitors, List<InstitutionGroupSpec> groups) {
        int maxRank = competitors.stream().mapToInt(CompetitorProfile::rank).max().orElse(0);
        List<InstitutionGroupResult> results = groups.stream()
                .map(group -> allocateGroup(group, competitors, maxRank))
                .toList();
        return new InstitutionAllocation(competitors.size(), maxRank, results);
    }

    InstitutionGroupResult allocateGroup(InstitutionGroupSpec group, List<CompetitorProfile> competitors, int maxRank) {
        Function<CompetitorProfile, String> field = group.groupBy() == null
                ? null
                : GROUP_BY_FIELDS.get(group.groupBy().trim().toLowerCase(Locale.ROOT));
        if (field == null) {
            log.warn("[alloc.institution] group={} name={} unknown groupBy={}", group.groupId(), group.name(), group.groupBy());
            List<InstitutionGroupResult.Placement> empty = group.prizes().stream()
                    .map(prize -> new InstitutionGroupResult.Placement(prize, null))
                    .toList();
            return new InstitutionGroupResult(group, empty, 0, 0, List.of("Invalid group_by value: " + group.groupBy()));
        }

        Map<String, List<InstitutionStanding.TeamMember>> members = new LinkedHashMap<>();
        competitors.stream()
                .sorted(CandidateOrdering.BY_RANK)
                .forEach(competitor -> {
                    String value = field.apply(competitor);
                    if (value == null || value.isBlank()) {
                        return;
                    }
                    members.computeIfAbsent(value.trim(), key -> new ArrayList<>()).add(new InstitutionStanding.TeamMember(
                            competitor.competitorId(),
                            competitor.name(),
                            competitor.rank(),
                            maxRank + 1 - competitor.rank(),
                            competitor.gender()
                    ));
                });

        List<InstitutionStanding> standings = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        int ineligible = 0;
        for (Map.Entry<String, List<InstitutionStanding.TeamMember>> entry : members.entrySet()) {
            List<InstitutionStanding.TeamMember> team = buildTeam(entry.getValue(), group);
            if (team == null) {
                ineligible++;
                if (reasons.size() < MAX_INELIGIBLE_REASONS) {
                    reasons.add(ineligibleReason(entry.getKey(), entry.getValue(), group));
                }
                continue;
            }
            standings.add(new InstitutionStanding(
                    entry.getKey(),
                    team.stream().mapToInt(InstitutionStanding.TeamMember::points).sum(),
                    team.stream().mapToInt(InstitutionStanding.TeamMember::rank).sum(),
                    team.stream().mapToInt(InstitutionStanding.TeamMember::rank).min().orElse(0),
                    team
            ));
        }
        standings.sort(STANDING_ORDER);

        List<InstitutionGroupResult.Placement> placements = group.prizes().stream()
                .map(prize -> {
                    int index = prize.place() - 1;
                    InstitutionStanding winner = index >= 0 && index < standings.size() ? standings.get(index) : null;
                    return new InstitutionGroupResult.Placement(prize, winner);
                })
                .toList();

        log.debug(
                "[alloc.institution] group={} groupBy={} institutions={} eligible={} ineligible={} prizes={}",
                group.groupId(),
                group.groupBy(),
                members.size(),
                standings.size(),
                ineligible,
                placements.size()
        );
        return new InstitutionGroupResult(group, placements, standings.size(), ineligible, reasons);
    }

    /**
     * @return the team in selection order, or null when the slots cannot be filled
     */
    static List<InstitutionStanding.TeamMember> buildTeam(
            List<InstitutionStanding.TeamMember> players,
            InstitutionGroupSpec group
    ) {
        List<InstitutionStanding.TeamMember> females = players.stream().filter(InstitutionPrizeAllocator::isFemale)
                .sorted(BY_SCORE).toList();
        List<InstitutionStanding.TeamMember> others = players.stream().filter(player -> !isFemale(player))
                .sorted(BY_SCORE).toList();
        if (females.size() < group.femaleSlots() || others.size() < group.maleSlots()) {
            return null;
        }

        List<InstitutionStanding.TeamMember> team = new ArrayList<>(females.subList(0, group.femaleSlots()));
        team.addAll(others.subList(0, group.maleSlots()));

        int openSeats = group.teamSize() - team.size();
        if (openSeats > 0) {
            Set<UUID> picked = new HashSet<>();
            team.forEach(member -> picked.add(member.competitorId()));
            List<InstitutionStanding.TeamMember> rest = players.stream()
                    .filter(player -> !picked.contains(player.competitorId()))
                    .sorted(BY_SCORE)
                    .toList();
            if (rest.size() < openSeats) {
                return null;
            }
            team.addAll(rest.subList(0, openSeats));
        }
        return team;
    }

    private static String ineligibleReason(
            String key,
            List<InstitutionStanding.TeamMember> players,
            InstitutionGroupSpec group
    ) {
        long females = players.stream().filter(InstitutionPrizeAllocator::isFemale).count();
        long others = players.size() - females;
        if (group.femaleSlots() > 0 && females < group.femaleSlots()) {
            return key + ": needs " + group.femaleSlots() + " females, has " + females;
        }
        if (group.maleSlots() > 0 && others < group.maleSlots()) {
            return key + ": needs " + group.maleSlots() + " males, has " + others;
        }
        return key + ": needs " + group.teamSize() + " players, has " + players.size();
    }

    private static boolean isFemale(InstitutionStanding.TeamMember member) {
        return member.gender() == Gender.F;
    }
}

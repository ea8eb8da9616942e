package com.softpower.backend.events.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.softpower.backend.events.dto.ConsolidationReport;
import com.softpower.backend.events.dto.ConsolidationStatus;
import com.softpower.backend.events.dto.CountryConsolidationResult;
import com.softpower.backend.events.dto.MergeStats;
import com.softpower.backend.events.entity.CanonicalEvent;
import com.softpower.backend.events.entity.DailyEventMention;
import com.softpower.backend.support.AbstractIntegrationTest;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class CanonicalEventConsolidationTest extends AbstractIntegrationTest {

    @Autowired
    private CanonicalEventMergeService mergeService;

    private MergeStats consolidate(String country, boolean dryRun) {
        CountryConsolidationResult result = mergeService.consolidateCountry(country, dryRun, true);
        assertThat(result.getStatus())
                .isEqualTo(dryRun ? ConsolidationStatus.DRY_RUN : ConsolidationStatus.SUCCEEDED);
        return result.getStats();
    }

    private static LocalDate day(String date) {
        return LocalDate.parse(date);
    }

    @Nested
    @DisplayName("Merge scenarios")
    class Scenarios {

        @Test
        @DisplayName("master without children yields zero activity and stays unchanged")
        void masterWithoutChildren() {
            CanonicalEvent master = master("China", "Belt and Road Forum");
            mention(master, "2024-01-01", 7, "doc-1");

            MergeStats stats = consolidate("China", false);

            assertThat(stats).isEqualTo(new MergeStats(1, 0, 0, 0, 0));
            assertThat(countsByDate(master)).containsExactly(Map.entry(day("2024-01-01"), 7));
            assertThat(eventRepository.findById(master.getId())).isPresent();
        }

        @Test
        @DisplayName("non-conflicting child mentions move onto the master and the child is deleted")
        void reassignsMentionsToEmptyMaster() {
            CanonicalEvent master = master("China", "Port investment in Piraeus");
            CanonicalEvent child = child(master, "Piraeus port deal day 2");
            mention(child, "2024-01-01", 5, "doc-1");
            mention(child, "2024-01-02", 3, "doc-2");

            MergeStats stats = consolidate("China", false);

            assertThat(stats.getMasterCount()).isEqualTo(1);
            assertThat(stats.getChildCount()).isEqualTo(1);
            assertThat(stats.getMentionsReassigned()).isEqualTo(2);
            assertThat(stats.getEventsDeleted()).isEqualTo(1);
            assertThat(stats.getConflictsMerged()).isZero();

            assertThat(countsByDate(master)).containsExactly(
                    Map.entry(day("2024-01-01"), 5),
                    Map.entry(day("2024-01-02"), 3));
            assertThat(eventRepository.findById(child.getId())).isEmpty();
        }

        @Test
        @DisplayName("a date the master already owns gets the child's articles added on")
        void additiveMergeOnConflictingDate() {
            CanonicalEvent master = master("China", "Vaccine diplomacy");
            CanonicalEvent child = child(master, "Vaccine shipments arrive");
            mention(master, "2024-01-01", 10, "doc-1");
            mention(child, "2024-01-01", 4, "doc-2", "doc-3");

            MergeStats stats = consolidate("China", false);

            assertThat(stats.getMentionsReassigned()).isEqualTo(1);
            assertThat(stats.getConflictsMerged()).isEqualTo(1);
            assertThat(stats.getEventsDeleted()).isEqualTo(1);

            List<DailyEventMention> mentions = mentionRepository.findByEventId(master.getId());
            assertThat(mentions).hasSize(1);
            assertThat(mentions.get(0).getArticleCount()).isEqualTo(14);
            assertThat(mentions.get(0).getDocIds()).containsExactlyInAnyOrder("doc-1", "doc-2", "doc-3");
            assertThat(mentionRepository.count()).isEqualTo(1);
            assertThat(eventRepository.findById(child.getId())).isEmpty();
        }

        @Test
        @DisplayName("a child without mentions is still deleted")
        void emptyChildIsDeleted() {
            CanonicalEvent master = master("China", "Confucius Institute closures");
            mention(master, "2024-02-01", 2, "doc-1");
            CanonicalEvent child = child(master, "Institute closure follow-up");

            MergeStats stats = consolidate("China", false);

            assertThat(stats).isEqualTo(new MergeStats(1, 1, 0, 1, 0));
            assertThat(eventRepository.findById(child.getId())).isEmpty();
        }

        @Test
        @DisplayName("masters without the validation flag are left alone")
        void unvalidatedMastersAreSkipped() {
            CanonicalEvent master = event("China", "Unreviewed grouping", false);
            CanonicalEvent child = child(master, "Possibly unrelated story");
            mention(child, "2024-01-03", 6, "doc-1");

            MergeStats stats = consolidate("China", false);

            assertThat(stats).isEqualTo(MergeStats.empty());
            assertThat(eventRepository.findById(child.getId())).isPresent();
            assertThat(countsByDate(child)).containsEntry(day("2024-01-03"), 6);
        }

        @Test
        @DisplayName("other countries are not touched")
        void countriesAreIsolated() {
            CanonicalEvent russianMaster = master("Russia", "Grain corridor talks");
            CanonicalEvent russianChild = child(russianMaster, "Grain corridor day 2");
            mention(russianChild, "2024-01-01", 3, "doc-1");

            consolidate("China", false);

            assertThat(eventRepository.findById(russianChild.getId())).isPresent();
            assertThat(countsByDate(russianMaster)).isEmpty();
        }

        @Test
        @DisplayName("a child stored under a master of another country is left to its own country")
        void crossCountryChildIsNotDrained() {
            CanonicalEvent russianMaster = master("Russia", "Gas pipeline diplomacy");
            mention(russianMaster, "2024-01-01", 2, "doc-1");
            CanonicalEvent chineseEvent = event("China", "Pipeline agreement signed", false);
            chineseEvent.setMasterEventId(russianMaster.getId());
            eventRepository.save(chineseEvent);
            mention(chineseEvent, "2024-01-02", 3, "doc-2");

            MergeStats stats = consolidate("Russia", false);

            assertThat(stats).isEqualTo(new MergeStats(1, 0, 0, 0, 0));
            assertThat(eventRepository.findById(chineseEvent.getId())).isPresent();
            assertThat(countsByDate(chineseEvent)).containsExactly(Map.entry(day("2024-01-02"), 3));
            assertThat(countsByDate(russianMaster)).containsExactly(Map.entry(day("2024-01-01"), 2));
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        private CanonicalEvent master;

        // M {18th: 2}, first child {18th: 3, 19th: 4}, second child {19th: 5, 20th: 1}
        private void seedOverlappingGroup() {
            master = master("China", "Summit with Central Asian states");
            CanonicalEvent first = child(master, "Xi'an summit opens");
            CanonicalEvent second = child(master, "Xi'an summit declarations");
            mention(master, "2024-05-18", 2, "doc-1");
            mention(first, "2024-05-18", 3, "doc-2");
            mention(first, "2024-05-19", 4, "doc-3");
            mention(second, "2024-05-19", 5, "doc-4");
            mention(second, "2024-05-20", 1, "doc-5");
        }

        @Test
        @DisplayName("article volume is conserved and dates stay unique per master")
        void conservationAndUniqueness() {
            seedOverlappingGroup();

            MergeStats stats = consolidate("China", false);

            assertThat(stats).isEqualTo(new MergeStats(1, 2, 4, 2, 2));
            assertThat(countsByDate(master)).containsExactly(
                    Map.entry(day("2024-05-18"), 5),
                    Map.entry(day("2024-05-19"), 9),
                    Map.entry(day("2024-05-20"), 1));
            assertThat(mentionRepository.findByEventId(master.getId())).hasSize(3);
            assertThat(mentionRepository.findDocIdsForEvents(List.of(master.getId())))
                    .containsExactly("doc-1", "doc-2", "doc-3", "doc-4", "doc-5");
        }

        // Same group as above; drain order follows the children's first mention dates
        private CanonicalEvent seedGroupDrainedInOrder(String country, boolean openingChildFirst) {
            CanonicalEvent groupMaster = master(country, "Summit with Central Asian states");
            CanonicalEvent opening = child(groupMaster, "Xi'an summit opens");
            CanonicalEvent declarations = child(groupMaster, "Xi'an summit declarations");
            opening.setFirstMentionDate(day(openingChildFirst ? "2024-05-18" : "2024-05-19"));
            declarations.setFirstMentionDate(day(openingChildFirst ? "2024-05-19" : "2024-05-18"));
            eventRepository.save(opening);
            eventRepository.save(declarations);

            mention(groupMaster, "2024-05-18", 2, "doc-1");
            mention(opening, "2024-05-18", 3, "doc-2");
            mention(opening, "2024-05-19", 4, "doc-3");
            mention(declarations, "2024-05-19", 5, "doc-4");
            mention(declarations, "2024-05-20", 1, "doc-5");
            return groupMaster;
        }

        @Test
        @DisplayName("draining children in opposite orders gives the same result")
        void drainOrderDoesNotMatter() {
            CanonicalEvent forward = seedGroupDrainedInOrder("China", true);
            CanonicalEvent reverse = seedGroupDrainedInOrder("Russia", false);

            assertThat(inTransaction(() -> eventRepository.findChildrenForUpdate(forward.getId(), "China")))
                    .extracting(CanonicalEvent::getCanonicalName)
                    .containsExactly("Xi'an summit opens", "Xi'an summit declarations");
            assertThat(inTransaction(() -> eventRepository.findChildrenForUpdate(reverse.getId(), "Russia")))
                    .extracting(CanonicalEvent::getCanonicalName)
                    .containsExactly("Xi'an summit declarations", "Xi'an summit opens");

            MergeStats forwardStats = consolidate("China", false);
            MergeStats reverseStats = consolidate("Russia", false);

            assertThat(forwardStats).isEqualTo(reverseStats).isEqualTo(new MergeStats(1, 2, 4, 2, 2));
            assertThat(countsByDate(forward)).isEqualTo(countsByDate(reverse)).containsExactly(
                    Map.entry(day("2024-05-18"), 5),
                    Map.entry(day("2024-05-19"), 9),
                    Map.entry(day("2024-05-20"), 1));

            Map<LocalDate, Set<String>> forwardDocs = docIdsByDate(forward);
            assertThat(forwardDocs).isEqualTo(docIdsByDate(reverse));
            assertThat(forwardDocs.get(day("2024-05-18"))).containsExactlyInAnyOrder("doc-1", "doc-2");
            assertThat(forwardDocs.get(day("2024-05-19"))).containsExactlyInAnyOrder("doc-3", "doc-4");
            assertThat(forwardDocs.get(day("2024-05-20"))).containsExactly("doc-5");
        }

        private Map<LocalDate, Set<String>> docIdsByDate(CanonicalEvent event) {
            Map<LocalDate, Set<String>> docs = new TreeMap<>();
            mentionRepository.findByEventId(event.getId())
                    .forEach(mention -> docs.put(mention.getMentionDate(), new TreeSet<>(mention.getDocIds())));
            return docs;
        }

        @Test
        @DisplayName("a second run is a no-op")
        void idempotent() {
            seedOverlappingGroup();
            consolidate("China", false);
            Map<LocalDate, Integer> afterFirstRun = countsByDate(master);

            MergeStats second = consolidate("China", false);

            assertThat(second.getMentionsReassigned()).isZero();
            assertThat(second.getEventsDeleted()).isZero();
            assertThat(second.hasActivity()).isFalse();
            assertThat(countsByDate(master)).isEqualTo(afterFirstRun);
        }

        @Test
        @DisplayName("dry run reports the same stats as the real run and writes nothing")
        void dryRunEquivalence() {
            seedOverlappingGroup();
            long eventsBefore = eventRepository.count();
            long mentionsBefore = mentionRepository.count();
            Map<LocalDate, Integer> masterBefore = countsByDate(master);

            MergeStats dryRun = consolidate("China", true);

            assertThat(eventRepository.count()).isEqualTo(eventsBefore);
            assertThat(mentionRepository.count()).isEqualTo(mentionsBefore);
            assertThat(countsByDate(master)).isEqualTo(masterBefore);

            MergeStats real = consolidate("China", false);

            assertThat(dryRun).isEqualTo(real);
            assertThat(countsByDate(master)).containsExactly(
                    Map.entry(day("2024-05-18"), 5),
                    Map.entry(day("2024-05-19"), 9),
                    Map.entry(day("2024-05-20"), 1));
        }

        @Test
        @DisplayName("master rollup fields follow the merged mentions")
        void masterRollupIsRefreshed() {
            seedOverlappingGroup();

            consolidate("China", false);

            CanonicalEvent merged = inTransaction(() -> {
                CanonicalEvent event = eventRepository.findById(master.getId()).orElseThrow();
                event.getAlternativeNames().size();
                return event;
            });
            assertThat(merged.getFirstMentionDate()).isEqualTo(day("2024-05-18"));
            assertThat(merged.getLastMentionDate()).isEqualTo(day("2024-05-20"));
            assertThat(merged.getTotalMentionDays()).isEqualTo(3);
            assertThat(merged.getTotalArticles()).isEqualTo(15);
            assertThat(merged.getPeakMentionDate()).isEqualTo(day("2024-05-19"));
            assertThat(merged.getPeakDailyArticleCount()).isEqualTo(9);
            assertThat(merged.getAlternativeNames())
                    .containsExactlyInAnyOrder("Xi'an summit opens", "Xi'an summit declarations");
        }
    }

    @Nested
    @DisplayName("Scopes")
    class Scopes {

        @Test
        @DisplayName("configured scope covers every configured country")
        void configuredScope() {
            CanonicalEvent china = master("China", "Space station cooperation");
            mention(child(china, "Space station day 2"), "2024-03-02", 2, "doc-1");
            CanonicalEvent russia = master("Russia", "Arctic shipping route");
            mention(child(russia, "Arctic route day 2"), "2024-03-02", 4, "doc-2");

            ConsolidationReport report = mergeService.consolidate(ConsolidationScope.configured(), false, false);

            assertThat(report.getCountries()).extracting(CountryConsolidationResult::getCountry)
                    .containsExactly("China", "Russia");
            assertThat(report.isSuccessful()).isTrue();
            assertThat(report.getTotals().getEventsDeleted()).isEqualTo(2);
            assertThat(report.getTotals().getMentionsReassigned()).isEqualTo(2);
        }

        @Test
        @DisplayName("a blank country is reported as skipped with zero activity")
        void blankCountryIsSkipped() {
            ConsolidationReport report = mergeService.consolidate(ConsolidationScope.country("  "), false);

            assertThat(report.getCountries()).singleElement().satisfies(result -> {
                assertThat(result.getStatus()).isEqualTo(ConsolidationStatus.SKIPPED);
                assertThat(result.getStats()).isEqualTo(MergeStats.empty());
            });
            assertThat(report.isSuccessful()).isTrue();
        }

        @Test
        @DisplayName("a country without validated masters succeeds with zero stats")
        void unknownCountryHasNoActivity() {
            MergeStats stats = consolidate("Atlantis", false);

            assertThat(stats).isEqualTo(MergeStats.empty());
        }
    }
}

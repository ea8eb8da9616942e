package com.softpower.backend.events.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.softpower.backend.events.entity.CanonicalEvent;
import com.softpower.backend.events.exception.HierarchyDepthException;
import com.softpower.backend.events.exception.NonEmptyChildException;
import com.softpower.backend.support.AbstractIntegrationTest;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class HierarchyLinkServiceTest extends AbstractIntegrationTest {

    @Autowired
    private CanonicalEventHierarchy hierarchy;

    @Test
    void linksChildToMaster() {
        CanonicalEvent master = master("Iran", "Drone exports");
        CanonicalEvent child = event("Iran", "Drone deliveries reported", false);

        CanonicalEvent linked = linkService.assignMaster(child.getId(), master.getId());

        assertThat(linked.getMasterEventId()).isEqualTo(master.getId());
        assertThat(linked.isMaster()).isFalse();
    }

    @Test
    void rejectsChildOfChildAsMaster() {
        CanonicalEvent master = master("Iran", "Drone exports");
        CanonicalEvent child = child(master, "Drone deliveries reported");
        CanonicalEvent grandchild = event("Iran", "Drone factory opens", false);

        assertThatThrownBy(() -> linkService.assignMaster(grandchild.getId(), child.getId()))
                .isInstanceOf(HierarchyDepthException.class)
                .hasMessageContaining("cannot act as a master");
        assertThat(eventRepository.findById(grandchild.getId()).orElseThrow().isMaster()).isTrue();
    }

    @Test
    void rejectsMasterWithChildrenBecomingChild() {
        CanonicalEvent master = master("Iran", "Drone exports");
        child(master, "Drone deliveries reported");
        CanonicalEvent otherMaster = master("Iran", "Military cooperation");

        assertThatThrownBy(() -> linkService.assignMaster(master.getId(), otherMaster.getId()))
                .isInstanceOf(HierarchyDepthException.class)
                .hasMessageContaining("already masters 1 event(s)");
    }

    @Test
    void rejectsEdgeAcrossCountries() {
        CanonicalEvent russianMaster = master("Russia", "Gas pipeline diplomacy");
        CanonicalEvent chineseEvent = event("China", "Pipeline agreement signed", false);

        assertThatThrownBy(() -> linkService.assignMaster(chineseEvent.getId(), russianMaster.getId()))
                .isInstanceOf(HierarchyDepthException.class)
                .hasMessageContaining("same country");
        assertThat(eventRepository.findById(chineseEvent.getId()).orElseThrow().getMasterEventId()).isNull();
    }

    @Test
    void rejectsSelfReferenceAndMissingRows() {
        CanonicalEvent master = master("Iran", "Drone exports");

        assertThatThrownBy(() -> linkService.assignMaster(master.getId(), master.getId()))
                .isInstanceOf(HierarchyDepthException.class);
        assertThatThrownBy(() -> linkService.assignMaster(UUID.randomUUID(), master.getId()))
                .isInstanceOf(HierarchyDepthException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void validationFlagOnlyOnMasters() {
        CanonicalEvent master = event("Turkey", "Bayraktar sales", false);
        CanonicalEvent child = child(master, "Bayraktar delivery to Poland");

        CanonicalEvent validated = linkService.markValidated(master.getId(), true);

        assertThat(validated.getLlmValidated()).isTrue();
        assertThat(validated.getLlmValidatedAt()).isNotNull();
        assertThatThrownBy(() -> linkService.markValidated(child.getId(), true))
                .isInstanceOf(HierarchyDepthException.class);
    }

    @Test
    void childThatStillOwnsMentionsIsNotDeleted() {
        CanonicalEvent master = master("Turkey", "Grain deal mediation");
        CanonicalEvent child = child(master, "Grain deal extended");
        mention(child, "2024-07-17", 3, "doc-1");

        assertThatThrownBy(() -> inTransaction(() -> {
            hierarchy.deleteDrainedChild(child, master);
            return null;
        }))
                .isInstanceOf(NonEmptyChildException.class)
                .satisfies(e -> assertThat(((NonEmptyChildException) e).getRemainingMentions()).isEqualTo(1));

        assertThat(eventRepository.findById(child.getId())).isPresent();
        assertThat(mentionRepository.findByEventId(child.getId())).hasSize(1);
    }
}

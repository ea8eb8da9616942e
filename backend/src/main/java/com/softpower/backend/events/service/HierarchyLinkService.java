package com.softpower.backend.events.service;

import com.softpower.backend.events.entity.CanonicalEvent;
import com.softpower.backend.events.exception.HierarchyDepthException;
import com.softpower.backend.events.repository.CanonicalEventRepository;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Guarded writes of master/child edges and of the group validation flag.
 * Every edge is checked so the hierarchy never grows past one level.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class HierarchyLinkService {

    private final CanonicalEventRepository eventRepository;

    public CanonicalEvent assignMaster(UUID childId, UUID masterId) {
        if (childId.equals(masterId)) {
            throw new HierarchyDepthException("Event " + childId + " cannot be its own master");
        }
        CanonicalEvent child = eventRepository.findByIdForUpdate(childId)
                .orElseThrow(() -> new HierarchyDepthException("Child event " + childId + " does not exist"));
        CanonicalEvent master = eventRepository.findByIdForUpdate(masterId)
                .orElseThrow(() -> new HierarchyDepthException("Master event " + masterId + " does not exist"));

        if (!master.isMaster()) {
            throw new HierarchyDepthException(String.format(
                    "Event %s is itself a child of %s and cannot act as a master",
                    masterId, master.getMasterEventId()));
        }
        // Countries are consolidated in separate transactions, so an edge may never cross them
        if (!Objects.equals(child.getCountry(), master.getCountry())) {
            throw new HierarchyDepthException(String.format(
                    "Event %s (%s) cannot join master %s (%s): both must belong to the same country",
                    childId, child.getCountry(), masterId, master.getCountry()));
        }
        Long ownChildren = eventRepository.countByMasterEventId(childId);
        if (ownChildren != null && ownChildren > 0) {
            throw new HierarchyDepthException(String.format(
                    "Event %s already masters %d event(s) and cannot become a child", childId, ownChildren));
        }

        child.setMasterEventId(masterId);
        log.debug("Linked child {} to master {}", childId, masterId);
        return eventRepository.save(child);
    }

    /**
     * Records the deconfliction verdict for a whole group. Only masters carry the flag.
     */
    public CanonicalEvent markValidated(UUID masterId, boolean validated) {
        CanonicalEvent master = eventRepository.findByIdForUpdate(masterId)
                .orElseThrow(() -> new HierarchyDepthException("Master event " + masterId + " does not exist"));
        if (!master.isMaster()) {
            throw new HierarchyDepthException("Only master events carry a validation flag; "
                    + masterId + " is a child of " + master.getMasterEventId());
        }
        master.setLlmValidated(validated);
        master.setLlmValidatedAt(validated ? LocalDateTime.now() : null);
        return eventRepository.save(master);
    }
}

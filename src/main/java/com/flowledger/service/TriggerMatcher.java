package com.flowledger.service;

import com.flowledger.dto.TriggerEvent;
import com.flowledger.model.WorkflowDefinition;
import com.flowledger.model.WorkflowSnapshot;
import com.flowledger.repository.WorkflowDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Selects the enabled definitions a trigger event starts.
 *
 *   manual / schedule_tick  → tenant + trigger type
 *   runtime_record_created  → tenant + trigger type + trigger entity
 *
 * Pure lookup: no runs are created here. An empty result is normal.
 * Results are snapshots ordered by logical name, so later edits to a
 * definition never reach the runs started from this match.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TriggerMatcher {

    private final WorkflowDefinitionRepository definitionRepository;

    @Transactional(readOnly = true)
    public List<WorkflowSnapshot> match(TriggerEvent event) {
        List<WorkflowDefinition> definitions;
        if (event.getTriggerType().isEntityScoped()) {
            if (event.getEntityLogicalName() == null || event.getEntityLogicalName().isBlank()) {
                log.debug("Entity-scoped trigger without entity ignored: tenant={}, type={}",
                        event.getTenantId(), event.getTriggerType());
                return List.of();
            }
            definitions = definitionRepository
                    .findByTenantIdAndTriggerTypeAndTriggerEntityLogicalNameAndEnabledTrueOrderByLogicalNameAsc(
                            event.getTenantId(), event.getTriggerType(), event.getEntityLogicalName());
        } else {
            definitions = definitionRepository.findByTenantIdAndTriggerTypeAndEnabledTrueOrderByLogicalNameAsc(
                    event.getTenantId(), event.getTriggerType());
        }

        List<WorkflowSnapshot> matches = definitions.stream()
                .filter(WorkflowDefinition::isEnabled)
                .map(WorkflowDefinition::snapshot)
                .collect(Collectors.toList());
        log.debug("Trigger matched {} workflow(s): tenant={}, type={}, entity={}",
                matches.size(), event.getTenantId(), event.getTriggerType(), event.getEntityLogicalName());
        return matches;
    }
}

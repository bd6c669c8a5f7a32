package com.flagship.agent_settlement.journal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntryEntity, UUID> {

    List<JournalEntryEntity> findBySubjectTypeAndSubjectIdOrderByCreatedAtAsc(String subjectType, UUID subjectId);
}

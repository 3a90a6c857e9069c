package wikisearch.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import wikisearch.model.ProcessedTerm;

@Repository
public interface ProcessedTermRepository extends JpaRepository<ProcessedTerm, Long> {

    boolean existsByTerm(String term);

    @Modifying
    @Transactional
    @Query(value = "INSERT INTO processed_terms (term, processed_at) VALUES (:term, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
            nativeQuery = true)
    int insertIgnoreConflict(@Param("term") String term);
}

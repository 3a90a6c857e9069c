package wikisearch.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import wikisearch.model.Page;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Stream;

@Repository
public interface PageRepository extends JpaRepository<Page, String> {

    @Query("SELECT p FROM Page p")
    Stream<Page> streamAll();

    List<Page> findByContentContaining(String fragment);

    /**
     * Returns 0 when a row with this url already exists, including one inserted by a
     * concurrent transaction that has not committed yet.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "INSERT INTO pages (url, title, content, language, last_updated) " +
            "VALUES (:url, :title, :content, :language, :lastUpdated) ON CONFLICT DO NOTHING",
            nativeQuery = true)
    int insertIgnoreConflict(@Param("url") String url,
                             @Param("title") String title,
                             @Param("content") String content,
                             @Param("language") String language,
                             @Param("lastUpdated") LocalDateTime lastUpdated);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Page p SET p.title = :title, p.content = :content, p.language = :language, " +
            "p.lastUpdated = :lastUpdated WHERE p.url = :url")
    int updateContent(@Param("url") String url,
                      @Param("title") String title,
                      @Param("content") String content,
                      @Param("language") String language,
                      @Param("lastUpdated") LocalDateTime lastUpdated);
}

package com.websubrelay.repository;

import com.websubrelay.model.ProcessedItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ProcessedItemRepository extends JpaRepository<ProcessedItem, String> {

    /**
     * Inserts the item unless a row with the same id exists. This is the
     * linearization point for concurrent workers handling the same item: a
     * concurrent insert blocks until the first transaction ends.
     *
     * @return 1 if this call created the row, 0 otherwise
     */
    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO items (item_id, source_id, title, published_at, received_at, created_at)
            VALUES (:itemId, :sourceId, :title, :publishedAt, :receivedAt, :createdAt)
            ON CONFLICT (item_id) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("itemId") String itemId,
                       @Param("sourceId") String sourceId,
                       @Param("title") String title,
                       @Param("publishedAt") Instant publishedAt,
                       @Param("receivedAt") Instant receivedAt,
                       @Param("createdAt") Instant createdAt);

    @Transactional
    @Modifying
    @Query("delete from ProcessedItem i where i.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}

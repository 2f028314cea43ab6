package com.funnelanalytics.infrastructure.persistence.repository;

import org.junit.jupiter.api.Test;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WebsiteEventRepositoryTest {

    @Test
    void testFindHits_OrderIsTotalWithinSession() throws NoSuchMethodException {
        Query query = WebsiteEventRepository.class
                .getMethod("findHits", UUID.class, Instant.class, Instant.class, Collection.class)
                .getAnnotation(Query.class);

        assertNotNull(query);
        assertTrue(query.value().endsWith("ORDER BY e.sessionId ASC, e.createdAt ASC, e.eventId ASC"),
                query.value());
    }

    @Test
    void testCountHits_MatchesFindHitsFilter() throws NoSuchMethodException {
        String find = WebsiteEventRepository.class
                .getMethod("findHits", UUID.class, Instant.class, Instant.class, Collection.class)
                .getAnnotation(Query.class).value();
        String count = WebsiteEventRepository.class
                .getMethod("countHits", UUID.class, Instant.class, Instant.class, Collection.class)
                .getAnnotation(Query.class).value();

        String findFilter = find.substring(find.indexOf("WHERE"), find.indexOf("ORDER BY")).trim();
        String countFilter = count.substring(count.indexOf("WHERE")).trim();
        assertEquals(findFilter, countFilter);
    }
}

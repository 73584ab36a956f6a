package io.github.drompincen.startpage.persistence.repository;

import io.github.drompincen.startpage.persistence.document.LinkDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface LinkRepository extends MongoRepository<LinkDocument, Long> {
    Optional<LinkDocument> findTopByCategoryOrderBySortIndexDesc(String category);
    List<LinkDocument> findByCategoryOrderByCreatedAtAscIdAsc(String category);
    List<LinkDocument> findBySortIndexIsNull();
    Optional<LinkDocument> findTopByOrderByIdDesc();
}

package io.github.drompincen.startpage.persistence.repository;

import io.github.drompincen.startpage.persistence.document.AdminDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface AdminRepository extends MongoRepository<AdminDocument, String> {
}

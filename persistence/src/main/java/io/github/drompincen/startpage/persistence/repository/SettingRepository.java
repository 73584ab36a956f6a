package io.github.drompincen.startpage.persistence.repository;

import io.github.drompincen.startpage.persistence.document.SettingDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SettingRepository extends MongoRepository<SettingDocument, String> {
}

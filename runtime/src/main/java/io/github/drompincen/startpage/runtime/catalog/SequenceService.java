package io.github.drompincen.startpage.runtime.catalog;

import io.github.drompincen.startpage.persistence.document.SequenceDocument;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

@Service
public class SequenceService {

    public static final String LINK_IDS = "links";

    private final MongoTemplate mongoTemplate;

    public SequenceService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public long next(String name) {
        SequenceDocument seq = mongoTemplate.findAndModify(
                query(where("_id").is(name)),
                new Update().inc("value", 1),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceDocument.class);
        if (seq == null) {
            throw new IllegalStateException("Sequence " + name + " could not be advanced");
        }
        return seq.getValue();
    }

    /** Raises the counter so the next value is above {@code floor}. Never lowers it. */
    public void ensureAtLeast(String name, long floor) {
        SequenceDocument current = mongoTemplate.findById(name, SequenceDocument.class);
        if (current == null || current.getValue() < floor) {
            mongoTemplate.save(new SequenceDocument(name, floor));
        }
    }
}

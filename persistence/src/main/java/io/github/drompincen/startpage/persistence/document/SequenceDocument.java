package io.github.drompincen.startpage.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** Named monotonically increasing counter, advanced atomically with findAndModify. */
@Document(collection = "sequences")
public class SequenceDocument {

    @Id
    private String name;
    private long value;

    public SequenceDocument() {}

    public SequenceDocument(String name, long value) {
        this.name = name;
        this.value = value;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public long getValue() { return value; }
    public void setValue(long value) { this.value = value; }
}

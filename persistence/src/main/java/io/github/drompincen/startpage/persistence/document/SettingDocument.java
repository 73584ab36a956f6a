package io.github.drompincen.startpage.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "settings")
public class SettingDocument {

    public static final String SITE_TITLE = "site_title";
    public static final String SITE_LOGO = "site_logo";
    public static final String HIDDEN_CATEGORIES = "hidden_categories";
    public static final String CATEGORY_ORDER = "category_order";

    @Id
    private String key;
    // list-valued settings are stored as JSON arrays
    private String value;

    public SettingDocument() {}

    public SettingDocument(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }
}

package com.pantrysync.backend.shopping.config;

import com.pantrysync.backend.shopping.model.ShoppingField;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumSet;
import java.util.Set;

/**
 * application.yml:
 * pantry.shopping.*
 */
@ConfigurationProperties(prefix = "pantry.shopping")
public class ShoppingSchemaProperties {

    /** 這個部署的購物清單有哪些欄位（name 固定存在，不用列） */
    private Set<ShoppingField> fields = EnumSet.allOf(ShoppingField.class);

    /** 新增時 candidate 沒帶 status 用這個 */
    private String defaultStatus = "pending";

    // ===== getters/setters =====
    public Set<ShoppingField> getFields() { return fields; }
    public void setFields(Set<ShoppingField> fields) { this.fields = fields; }

    public String getDefaultStatus() { return defaultStatus; }
    public void setDefaultStatus(String defaultStatus) { this.defaultStatus = defaultStatus; }
}

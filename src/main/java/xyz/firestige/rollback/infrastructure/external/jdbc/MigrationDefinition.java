package xyz.firestige.rollback.infrastructure.external.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * 迁移定义：版本号 + 逆向脚本
 * <p>
 * downSql 按顺序执行，将 schema 从该版本退回上一个版本
 */
public class MigrationDefinition {

    private String version;
    private String description;
    private List<String> downSql = new ArrayList<>();

    public MigrationDefinition() {
    }

    public MigrationDefinition(String version, String description, List<String> downSql) {
        this.version = version;
        this.description = description;
        this.downSql = downSql != null ? new ArrayList<>(downSql) : new ArrayList<>();
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getDownSql() {
        return downSql;
    }

    public void setDownSql(List<String> downSql) {
        this.downSql = downSql;
    }
}

package xyz.firestige.rollback.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;

import java.io.IOException;

/**
 * 持久化用 ObjectMapper
 * <p>
 * - 时间按 ISO 字符串写出
 * - 值对象（DeploymentId / ExecutionId）写成纯字符串
 * - 忽略未知字段，兼容记录类上的派生 getter
 */
public final class RollbackObjectMapperFactory {

    private RollbackObjectMapperFactory() {
    }

    public static ObjectMapper create() {
        SimpleModule valueObjects = new SimpleModule("rollback-value-objects");
        valueObjects.addSerializer(DeploymentId.class, new JsonSerializer<>() {
            @Override
            public void serialize(DeploymentId value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.writeString(value.getValue());
            }
        });
        valueObjects.addDeserializer(DeploymentId.class, new JsonDeserializer<>() {
            @Override
            public DeploymentId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                return DeploymentId.ofTrusted(p.getValueAsString());
            }
        });
        valueObjects.addSerializer(ExecutionId.class, new JsonSerializer<>() {
            @Override
            public void serialize(ExecutionId value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.writeString(value.getValue());
            }
        });
        valueObjects.addDeserializer(ExecutionId.class, new JsonDeserializer<>() {
            @Override
            public ExecutionId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                return ExecutionId.ofTrusted(p.getValueAsString());
            }
        });

        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(valueObjects)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}

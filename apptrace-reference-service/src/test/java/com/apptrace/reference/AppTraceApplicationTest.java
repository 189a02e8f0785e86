package com.apptrace.reference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.apptrace.controller.otlp.OtlpIngestController;
import com.apptrace.service.core.config.StorageConfigurationException;
import com.apptrace.service.core.memory.InMemoryLogStorage;
import com.apptrace.service.core.spi.LogStorage;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceRequest;
import io.opentelemetry.proto.collector.logs.v1.ExportLogsServiceResponse;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.logs.v1.LogRecord;
import io.opentelemetry.proto.logs.v1.ResourceLogs;
import io.opentelemetry.proto.logs.v1.ScopeLogs;
import io.opentelemetry.proto.resource.v1.Resource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest(properties = "apptrace.storage.type=memory")
@AutoConfigureMockMvc
class AppTraceApplicationTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    LogStorage logStorage;

    @Test
    void memoryStorageIsWired() {
        assertThat(logStorage).isInstanceOf(InMemoryLogStorage.class);
    }

    @Test
    void exportedLogsAreQueryable() throws Exception {
        ExportLogsServiceRequest request = ExportLogsServiceRequest.newBuilder()
                .addResourceLogs(ResourceLogs.newBuilder()
                        .setResource(Resource.newBuilder()
                                .addAttributes(KeyValue.newBuilder()
                                        .setKey("service.name")
                                        .setValue(AnyValue.newBuilder().setStringValue("cart-service"))))
                        .addScopeLogs(ScopeLogs.newBuilder()
                                .addLogRecords(LogRecord.newBuilder()
                                        .setTimeUnixNano(1_717_243_200_000_000_000L)
                                        .setSeverityText("ERROR")
                                        .setBody(AnyValue.newBuilder().setStringValue("cart checkout exploded")))))
                .build();

        MvcResult result = mvc.perform(post("/v1/logs")
                        .contentType(OtlpIngestController.APPLICATION_X_PROTOBUF)
                        .content(request.toByteArray()))
                .andExpect(status().isOk())
                .andReturn();
        assertThat(ExportLogsServiceResponse.parseFrom(result.getResponse().getContentAsByteArray())
                        .hasPartialSuccess())
                .isFalse();

        mvc.perform(get("/api/logs").param("search", "EXPLODED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].body").value("cart checkout exploded"))
                .andExpect(jsonPath("$[0].severity").value("ERROR"))
                .andExpect(jsonPath("$[0].timestamp").value("2024-06-01T12:00:00Z"))
                .andExpect(jsonPath("$[0].attributes['service.name']").value("cart-service"));
    }

    @Test
    void persistentStorageWithoutUrlRefusesToStart() {
        SpringApplicationBuilder app = new SpringApplicationBuilder(AppTraceApplication.class)
                .web(WebApplicationType.NONE);

        // command-line arguments outrank the environment defaults in application.yml
        assertThatThrownBy(() -> app.run("--apptrace.storage.type=bulk", "--apptrace.storage.connection.url="))
                .hasRootCauseInstanceOf(StorageConfigurationException.class)
                .hasRootCauseMessage("apptrace.storage.connection.url is required for storage type bulk");
    }
}

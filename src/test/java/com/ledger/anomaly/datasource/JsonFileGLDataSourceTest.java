package com.ledger.anomaly.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ledger.anomaly.model.DebitCredit;
import com.ledger.anomaly.model.GLFilter;
import com.ledger.anomaly.model.LineItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileGLDataSourceTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Test
    void getGLLineItems_readsAndFiltersByAccount() {
        JsonFileGLDataSource dataSource = new JsonFileGLDataSource(objectMapper,
                new ClassPathResource("ledger/test-line-items.json"));

        List<LineItem> items = dataSource.getGLLineItems(GLFilter.forAccount("700000", "2024", null)).join();

        assertThat(items).extracting(LineItem::getDocumentNumber).containsExactly("R1", "R2");
        LineItem reversal = items.get(1);
        assertThat(reversal.isReversal()).isTrue();
        assertThat(reversal.getReversalDocumentNumber()).isEqualTo("R1");
        assertThat(reversal.getDebitCredit()).isEqualTo(DebitCredit.CREDIT);
        assertThat(reversal.getPostingDate()).isEqualTo(LocalDate.of(2024, 4, 12));
        assertThat(reversal.getPostingTime()).isEqualTo(LocalTime.of(14, 30));
    }

    @Test
    void getGLLineItems_otherFiscalYear_empty() {
        JsonFileGLDataSource dataSource = new JsonFileGLDataSource(objectMapper,
                new ClassPathResource("ledger/test-line-items.json"));

        assertThat(dataSource.getGLLineItems(GLFilter.builder().fiscalYear("2023").build()).join()).isEmpty();
    }

    @Test
    void getGLLineItems_missingResource_failsFuture() {
        JsonFileGLDataSource dataSource = new JsonFileGLDataSource(objectMapper,
                new ClassPathResource("ledger/does-not-exist.json"));

        assertThatThrownBy(() -> dataSource.getGLLineItems(GLFilter.builder().fiscalYear("2024").build()).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(GLDataSourceException.class);
    }
}

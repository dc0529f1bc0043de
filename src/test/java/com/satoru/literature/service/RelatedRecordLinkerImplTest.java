package com.satoru.literature.service;

import com.satoru.literature.Fixtures;
import com.satoru.literature.exception.StructuralException;
import com.satoru.literature.infra.EutilsTransport;
import com.satoru.literature.infra.RateGovernor;
import com.satoru.literature.model.FetchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.MultiValueMap;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelatedRecordLinkerImplTest {

    @Mock
    private RateGovernor rateGovernor;

    @Mock
    private EutilsTransport transport;

    @Mock
    private RecordFetcher recordFetcher;

    private RelatedRecordLinkerImpl linker;

    @BeforeEach
    void setUp() {
        linker = new RelatedRecordLinkerImpl(rateGovernor, transport, recordFetcher, EutilsTestSupport.properties());
    }

    @Test
    @DisplayName("Linked ids exclude the source and duplicates and follow link order")
    @SuppressWarnings("unchecked")
    void shouldFetchRelatedIds() {
        when(transport.get(eq("elink"), any(), any())).thenReturn(Fixtures.load("elink-related.xml"));
        FetchResult fetched = FetchResult.empty();
        when(recordFetcher.fetchByIds(anyList(), eq(EutilsTestSupport.TIMEOUT))).thenReturn(fetched);

        FetchResult result = linker.related("34567890", 10);

        assertThat(result).isSameAs(fetched);
        verify(recordFetcher).fetchByIds(List.of("31111111", "32222222", "33333333"), EutilsTestSupport.TIMEOUT);

        ArgumentCaptor<MultiValueMap<String, String>> params = ArgumentCaptor.forClass(MultiValueMap.class);
        verify(transport).get(eq("elink"), params.capture(), any());
        assertThat(params.getValue().toSingleValueMap())
            .containsEntry("dbfrom", "pubmed")
            .containsEntry("db", "pubmed")
            .containsEntry("id", "34567890")
            .containsEntry("linkname", "pubmed_pubmed");
    }

    @Test
    @DisplayName("Related ids are capped at max results")
    void shouldCapRelatedIds() {
        when(transport.get(eq("elink"), any(), any())).thenReturn(Fixtures.load("elink-related.xml"));
        when(recordFetcher.fetchByIds(anyList(), any())).thenReturn(FetchResult.empty());

        linker.related("34567890", 2);

        verify(recordFetcher).fetchByIds(List.of("31111111", "32222222"), EutilsTestSupport.TIMEOUT);
    }

    @Test
    @DisplayName("Zero related ids yields an empty result without error or fetch")
    void shouldReturnEmptyWhenNothingRelated() {
        when(transport.get(eq("elink"), any(), any())).thenReturn(Fixtures.load("elink-none.xml"));

        FetchResult result = linker.related("99999999", 10);

        assertThat(result.articles()).isEmpty();
        assertThat(result.totalCount()).isZero();
        verifyNoInteractions(recordFetcher);
    }

    @Test
    @DisplayName("Remote error document is a structural error")
    void shouldRejectErrorDocument() {
        when(transport.get(eq("elink"), any(), any())).thenReturn(
            "<eLinkResult><ERROR>Invalid uid</ERROR></eLinkResult>".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> linker.related("abc", 10))
            .isInstanceOf(StructuralException.class)
            .hasMessageContaining("Invalid uid");
    }
}

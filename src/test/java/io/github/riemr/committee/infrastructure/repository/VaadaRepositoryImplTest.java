package io.github.riemr.committee.infrastructure.repository;

import io.github.riemr.committee.infrastructure.mapper.VaadaMapper;
import io.github.riemr.committee.infrastructure.persistence.entity.VaadaEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class VaadaRepositoryImplTest {

    @Test
    void listEvents_skipsQueryForEmptyIds() {
        VaadaMapper mapper = mock(VaadaMapper.class);
        VaadaRepositoryImpl repository = new VaadaRepositoryImpl(mapper);

        assertThat(repository.listEvents(List.of())).isEmpty();
        assertThat(repository.listEvents(null)).isEmpty();
        verify(mapper, never()).selectEventsByVaadaIds(any());
    }

    @Test
    void listEvents_delegatesToMapper() {
        VaadaMapper mapper = mock(VaadaMapper.class);
        VaadaEvent event = new VaadaEvent();
        when(mapper.selectEventsByVaadaIds(List.of(1L, 2L))).thenReturn(List.of(event));

        assertThat(new VaadaRepositoryImpl(mapper).listEvents(List.of(1L, 2L))).containsExactly(event);
    }
}

package com.company.outages.repository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class LinkStatusChangeRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private LinkStatusChangeRepository repository;

    @Test
    void emptyLinkSetSkipsTheStore() {
        assertThat(repository.findTransitions(List.of(), Instant.now())).isEmpty();
        assertThat(repository.findLatestDrainStarts(List.of())).isEmpty();

        verifyNoInteractions(jdbcTemplate);
    }
}

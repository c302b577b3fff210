package com.websubrelay.repository;

import com.websubrelay.model.InterestedAccount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcAccountDirectoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcAccountDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new JdbcAccountDirectory(jdbcTemplate, List.of(" 900 ", "901", ""));
    }

    @Test
    void rowsAreGroupedPerAccountWithDuplicateTargetsDropped() throws SQLException {
        givenRows(
                row("a1", "Alice", "100"),
                row("a1", "Alice", "200"),
                row("a1", "Alice", "200"),
                row("a2", "Bob", "300"));

        List<InterestedAccount> accounts = directory.accountsWatching("UC1");

        assertThat(accounts).containsExactly(
                new InterestedAccount("a1", "Alice", List.of("100", "200")),
                new InterestedAccount("a2", "Bob", List.of("300")));
    }

    @Test
    void accountWithoutTargetsFallsBackToDefaultChats() throws SQLException {
        givenRows(
                row("a1", "Alice", null),
                row("a2", "Bob", "300"));

        List<InterestedAccount> accounts = directory.accountsWatching("UC1");

        assertThat(accounts).containsExactly(
                new InterestedAccount("a1", "Alice", List.of("900", "901")),
                new InterestedAccount("a2", "Bob", List.of("300")));
    }

    @Test
    void sourceNobodyWatchesHasNoAccounts() {
        givenRows();

        assertThat(directory.accountsWatching("UC1")).isEmpty();
    }

    private void givenRows(ResultSet... rows) {
        doAnswer(invocation -> {
            RowCallbackHandler handler = invocation.getArgument(1);
            for (ResultSet rs : rows) {
                handler.processRow(rs);
            }
            return null;
        }).when(jdbcTemplate).query(anyString(), any(RowCallbackHandler.class), eq("UC1"));
    }

    private static ResultSet row(String accountId, String name, String target) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("id")).thenReturn(accountId);
        when(rs.getString("name")).thenReturn(name);
        when(rs.getString("target")).thenReturn(target);
        return rs;
    }
}

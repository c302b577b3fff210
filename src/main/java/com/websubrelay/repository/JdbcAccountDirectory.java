package com.websubrelay.repository;

import com.websubrelay.model.InterestedAccount;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class JdbcAccountDirectory implements AccountDirectory {

    private static final String ACCOUNTS_WATCHING_SQL = """
            SELECT a.id, a.name, t.target
            FROM accounts a
            JOIN feeds f ON f.account_id = a.id
            LEFT JOIN account_targets t ON t.account_id = a.id
            WHERE f.channel_id = ?
            ORDER BY a.id, t.target
            """;

    private final JdbcTemplate jdbcTemplate;
    // Accounts without their own targets fall back to the bot's default chats.
    private final List<String> defaultTargets;

    public JdbcAccountDirectory(JdbcTemplate jdbcTemplate,
                                @Value("${app.telegram.default-chat-ids:}") List<String> defaultTargets) {
        this.jdbcTemplate = jdbcTemplate;
        this.defaultTargets = defaultTargets.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public List<InterestedAccount> accountsWatching(String sourceId) {
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, List<String>> targets = new LinkedHashMap<>();
        jdbcTemplate.query(ACCOUNTS_WATCHING_SQL, (RowCallbackHandler) rs -> {
            String accountId = rs.getString("id");
            names.putIfAbsent(accountId, rs.getString("name"));
            List<String> accountTargets = targets.computeIfAbsent(accountId, k -> new ArrayList<>());
            String target = rs.getString("target");
            if (target != null && !accountTargets.contains(target)) {
                accountTargets.add(target);
            }
        }, sourceId);

        List<InterestedAccount> accounts = new ArrayList<>(names.size());
        names.forEach((accountId, name) -> {
            List<String> own = targets.get(accountId);
            accounts.add(new InterestedAccount(accountId, name, own.isEmpty() ? defaultTargets : own));
        });
        return accounts;
    }
}

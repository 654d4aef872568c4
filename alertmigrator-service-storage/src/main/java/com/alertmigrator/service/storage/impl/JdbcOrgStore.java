package com.alertmigrator.service.storage.impl;

import com.alertmigrator.service.core.store.OrgStore;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcOrgStore implements OrgStore {
    private final NamedParameterJdbcTemplate jdbc;

    public JdbcOrgStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<Long> findAllOrgIds() {
        return jdbc.queryForList("select id from org order by id", new MapSqlParameterSource(), Long.class);
    }
}

package com.coursepulse.service.storage.impl;

import com.coursepulse.service.core.store.StoreHealthProbe;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JdbcStoreHealthProbe implements StoreHealthProbe {

    private final JdbcTemplate jdbc;

    @Override
    public void ping() {
        jdbc.queryForObject("select 1", Integer.class);
    }
}

package com.di.pgproof.target;

import com.di.pgproof.config.DbConfigSnapshot;
import com.di.pgproof.util.HikariDataSource;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * {@link ConnectionPoolFactory} backed by the shared {@link HikariDataSource} cache. Closes every
 * pool when the application context shuts down.
 */
@Component
public class HikariConnectionPoolFactory implements ConnectionPoolFactory, DisposableBean {

    @Override
    public DataSource getOrCreate(DbConfigSnapshot snapshot) {
        return HikariDataSource.INSTANCE.getOrInit(snapshot);
    }

    @Override
    public void evict(DbConfigSnapshot snapshot) {
        HikariDataSource.INSTANCE.closeDataSource(snapshot);
    }

    @Override
    public void destroy() {
        HikariDataSource.INSTANCE.closeAll();
    }
}

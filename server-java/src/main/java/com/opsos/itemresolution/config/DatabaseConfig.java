package com.opsos.itemresolution.config;

import com.opsos.itemresolution.model.CanonicalItem;
import com.opsos.itemresolution.model.Invoice;
import com.opsos.itemresolution.model.InvoiceLine;
import com.opsos.itemresolution.model.ItemCostHistory;
import com.opsos.itemresolution.model.PackConfiguration;
import com.opsos.itemresolution.model.Vendor;
import com.opsos.itemresolution.model.VendorItemAlias;
import jakarta.persistence.EntityManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.orm.jpa.EntityManagerFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.orm.jpa.LocalContainerEntityManagerFactoryBean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.File;
import java.util.HashMap;
import java.util.Map;

@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(
    basePackages = "com.opsos.itemresolution.repository",
    entityManagerFactoryRef = "entityManagerFactory",
    transactionManagerRef = "transactionManager"
)
public class DatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);
    private static final String JDBC_PREFIX = "jdbc:sqlite:";

    @Bean(name = "dataSource")
    @Primary
    public DataSource dataSource(@Value("${resolution.datasource.url:jdbc:sqlite:data/item-resolution.db}") String url,
                                 @Value("${resolution.datasource.busy-timeout-ms:30000}") int busyTimeoutMs) {
        ensureDataDirectory(url);

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(busyTimeoutMs);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl(url);
        return dataSource;
    }

    private void ensureDataDirectory(String url) {
        if (url == null || !url.startsWith(JDBC_PREFIX)) {
            return;
        }
        String path = url.substring(JDBC_PREFIX.length());
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isBlank() || path.startsWith(":memory:")) {
            return;
        }
        File parent = new File(path).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists()) {
            if (parent.mkdirs()) {
                logger.info("[DatabaseConfig] Created data directory {}", parent);
            } else {
                logger.warn("[DatabaseConfig] Failed to create data directory {}", parent);
            }
        }
    }

    @Bean(name = "entityManagerFactory")
    @Primary
    public LocalContainerEntityManagerFactoryBean entityManagerFactory(
            EntityManagerFactoryBuilder builder,
            @Qualifier("dataSource") DataSource dataSource,
            @Value("${resolution.datasource.ddl-auto:update}") String ddlAuto,
            @Value("${resolution.datasource.show-sql:false}") String showSql) {
        Map<String, String> properties = new HashMap<>();
        properties.put("hibernate.dialect", "org.hibernate.community.dialect.SQLiteDialect");
        properties.put("hibernate.hbm2ddl.auto", ddlAuto);
        properties.put("hibernate.show_sql", showSql);
        properties.put("hibernate.format_sql", "true");

        return builder
            .dataSource(dataSource)
            .packages(
                CanonicalItem.class,
                PackConfiguration.class,
                Vendor.class,
                VendorItemAlias.class,
                Invoice.class,
                InvoiceLine.class,
                ItemCostHistory.class
            )
            .persistenceUnit("resolution")
            .properties(properties)
            .build();
    }

    @Bean(name = "transactionManager")
    @Primary
    public PlatformTransactionManager transactionManager(
            @Qualifier("entityManagerFactory") EntityManagerFactory entityManagerFactory) {
        return new JpaTransactionManager(entityManagerFactory);
    }
}

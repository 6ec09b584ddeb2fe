package org.iceforge.governor.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.governor.cache.CacheKeys;
import org.iceforge.governor.cache.CacheStore;
import org.iceforge.governor.quota.QuotaExceededException;
import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.quota.QuotaPolicy;
import org.iceforge.governor.quota.ResourceType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class QueryServiceTest {

    private final ExecutorService exec = Executors.newSingleThreadExecutor();

    private QuotaLedger ledger;
    private CacheFacade facade;
    private QueryService svc;

    @BeforeEach
    void setUp() {
        JdbcTemplate jdbc = new JdbcTemplate(new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1"));
        jdbc.execute("create table orders(id int primary key, amount int)");
        jdbc.update("insert into orders values (1, 10), (2, 20)");

        ledger = new QuotaLedger();
        facade = new CacheFacade(new CacheStore(100, 1024 * 1024), ledger, exec,
                new FacadeOptions(Duration.ofMinutes(5), 1024, Duration.ofSeconds(10)));
        svc = new QueryService(facade, jdbc, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        exec.shutdownNow();
    }

    @Test
    void run_missThenHit_computesOnce() {
        QueryService.QueryRequest req = new QueryService.QueryRequest("acme", "select sum(amount) as total from orders", null, null);

        QueryService.QueryResult first = svc.run(req);
        QueryService.QueryResult second = svc.run(req);

        assertFalse(first.hit());
        assertTrue(second.hit());
        assertArrayEquals(first.body(), second.body());
        assertEquals("{\"TOTAL\":30}\n", new String(second.body()));
        assertEquals(1, facade.computations());
        assertEquals(CacheKeys.forQuery(req.sql()), first.key());
    }

    @Test
    void run_chargesCachedBytesToTenant() {
        QueryService.QueryResult r = svc.run(new QueryService.QueryRequest("acme", "select id from orders order by id", null, 60L));

        assertEquals(r.body().length, ledger.usage("acme").get(ResourceType.CACHE_BYTES));
    }

    @Test
    void run_withTable_usesTableKeySoPrefixInvalidationDropsIt() {
        QueryService.QueryResult r = svc.run(new QueryService.QueryRequest("acme", "select id from orders", "orders", null));

        assertTrue(r.key().startsWith(CacheKeys.tablePrefix("orders")));
        assertEquals(1, facade.store().invalidatePrefix(CacheKeys.tablePrefix("orders")));
        assertEquals(0L, ledger.usage("acme").get(ResourceType.CACHE_BYTES));
    }

    @Test
    void run_overCacheQuota_throwsAndDoesNotCompute() {
        ledger.setPolicy(new QuotaPolicy("acme", ResourceType.CACHE_BYTES, 10));

        assertThrows(QuotaExceededException.class,
                () -> svc.run(new QueryService.QueryRequest("acme", "select * from orders", null, null)));
        assertEquals(0, facade.computations());
    }

    @Test
    void run_validatesRequest() {
        assertThrows(IllegalArgumentException.class, () -> svc.run(new QueryService.QueryRequest(" ", "select 1", null, null)));
        assertThrows(IllegalArgumentException.class, () -> svc.run(new QueryService.QueryRequest("acme", null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> svc.run(new QueryService.QueryRequest("acme", "select 1", null, 0L)));
    }
}

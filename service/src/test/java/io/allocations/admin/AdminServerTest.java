package io.allocations.admin;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.zaxxer.hikari.HikariDataSource;
import io.allocations.core.Cluster;
import io.allocations.error.FailureSink;
import io.allocations.runtime.ReconciliationDriver;
import io.allocations.service.ServiceFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class AdminServerTest {
    @TempDir
    Path tmp;

    ServiceFixture fixture;
    HikariDataSource dataSource;
    ReconciliationDriver driver;
    AdminServer http;
    final HttpClient client = HttpClient.newHttpClient();

    @BeforeEach
    void setup() throws Exception {
        fixture = new ServiceFixture(tmp);
        Cluster smp = fixture.records.createCluster("smp", "Shared memory", true);
        fixture.teamWithExpiredAllocation("physics", smp);
        fixture.slurm.account("physics", 1300, 1200);

        Injector injector = Guice.createInjector(fixture.module());
        dataSource = injector.getInstance(HikariDataSource.class);
        driver = injector.getInstance(ReconciliationDriver.class);
        http = new AdminServer(0, driver, injector.getInstance(MetricRegistry.class), injector.getInstance(FailureSink.class));
        http.start();
    }

    @AfterEach
    void tearDown() {
        if (http != null) http.close();
        if (driver != null) driver.close();
        if (dataSource != null) dataSource.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).POST(HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) { return URI.create("http://127.0.0.1:" + http.port() + path); }

    @Test
    void status_reports_last_pass_after_on_demand_reconcile() throws Exception {
        HttpResponse<String> before = get("/status");
        assertEquals(200, before.statusCode());
        assertEquals("{\"running\":false,\"lastPass\":null}", before.body());

        HttpResponse<String> pass = post("/reconcile/smp");
        assertEquals(200, pass.statusCode());
        assertTrue(pass.body().contains("\"UPDATED\":1"));
        assertEquals(1500, fixture.slurm.limit("physics"));

        HttpResponse<String> after = get("/status");
        assertTrue(after.body().contains("\"newLimit\":1500"));
    }

    @Test
    void metrics_include_unit_meters_after_a_pass() throws Exception {
        post("/reconcile");

        HttpResponse<String> metrics = get("/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("\"reconcile.unit.success\":{\"count\":1"));
        assertTrue(metrics.body().contains("\"reconcile.allocations.closed\":1"));
    }

    @Test
    void errors_tail_the_failure_log() throws Exception {
        fixture.slurm.account("chem", 5, 5).unavailableFor("chem");
        post("/reconcile");

        HttpResponse<String> errors = get("/errors?limit=5");
        assertEquals(200, errors.statusCode());
        assertTrue(errors.body().startsWith("{\"errors\":[{"));
        assertTrue(errors.body().contains("\"account\":\"chem\""));
        assertEquals(400, get("/errors?limit=lots").statusCode());
    }

    @Test
    void unknown_cluster_and_wrong_method_are_rejected() throws Exception {
        assertEquals(404, post("/reconcile/nope").statusCode());
        assertEquals(405, get("/reconcile").statusCode());
        assertEquals(405, post("/status").statusCode());
    }
}

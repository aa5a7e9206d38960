package no.ssb.dapla.pathfinder.model;

import io.helidon.common.reactive.Single;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static no.ssb.dapla.pathfinder.model.NetFixtures.net;
import static no.ssb.dapla.pathfinder.model.NetFixtures.p;
import static no.ssb.dapla.pathfinder.model.NetFixtures.render;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetAsyncTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void thatAsyncSearchFindsTheSamePathsInTheSameOrder() throws Exception {
        Net<SimplePoint> net = net("A:BD", "B:ACD", "C:BD", "D:ABC");

        List<Path<SimplePoint>> paths = net.findPathsAsync(p('A'), p('C'), executor)
                .toCompletableFuture()
                .get(10, TimeUnit.SECONDS);

        assertThat(paths).isEqualTo(net.findPaths(p('A'), p('C')));
        assertThat(render(paths)).containsExactly("A-B-C", "A-B-D-C", "A-D-B-C", "A-D-C");
    }

    @Test
    void thatAsyncSearchToItselfIsTheSinglePoint() throws Exception {
        Net<SimplePoint> net = net("A:B", "B:A");

        List<Path<SimplePoint>> paths = net.findPathsAsync(p('A'), p('A'), executor)
                .toCompletableFuture()
                .get(10, TimeUnit.SECONDS);

        assertThat(render(paths)).containsExactly("A");
    }

    @Test
    void thatAsyncSearchReportsUnknownPoints() {
        Net<SimplePoint> net = net("A:B", "B:A");

        assertThatThrownBy(() -> net.findPathsAsync(p('C'), p('A'), executor).toCompletableFuture().get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(PointNotFoundException.class);
    }

    @Test
    void thatAsyncSearchReportsNoPath() {
        Net<SimplePoint> net = net("A:E", "B:", "E:A");

        assertThatThrownBy(() -> net.findPathsAsync(p('A'), p('B'), executor).toCompletableFuture().get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(NoPathFoundException.class);
    }

    @Test
    void thatAsyncSearchReportsBrokenNet() {
        Net<SimplePoint> net = net("A:X", "C:");

        assertThatThrownBy(() -> net.findPathsAsync(p('A'), p('C'), executor).toCompletableFuture().get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(NetInconsistencyException.class);
    }

    @Test
    void thatRejectedBranchesFailTheSingle() throws Exception {
        Net<SimplePoint> net = net("A:BD", "B:ACD", "C:BD", "D:ABC");
        ExecutorService terminated = Executors.newSingleThreadExecutor();
        terminated.shutdown();
        assertThat(terminated.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        Single<List<Path<SimplePoint>>> single = net.findPathsAsync(p('A'), p('C'), terminated);

        assertThatThrownBy(() -> single.toCompletableFuture().get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);
    }
}

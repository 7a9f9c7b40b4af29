package kcs.pricepulse.service.crawler.browser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import kcs.pricepulse.exception.UpstreamBlockedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;

class BrowserPoolTest {

    private final List<WebDriver> created = new ArrayList<>();
    private BrowserPool pool;

    @BeforeEach
    void setUp() {
        pool = new BrowserPool(this::newDriver, 2, Duration.ofMillis(50), Duration.ofMillis(50));
    }

    @Test
    void shouldReuseHealthyDriver() {
        var first = pool.acquire();
        pool.release(first, true);

        var second = pool.acquire();

        assertThat(second).isSameAs(first);
        assertThat(created).hasSize(1);
    }

    @Test
    void shouldQuitUnhealthyDriverAndCreateNewOne() {
        var broken = pool.acquire();
        pool.release(broken, false);

        var replacement = pool.acquire();

        then(broken).should().quit();
        assertThat(replacement).isNotSameAs(broken);
        assertThat(created).hasSize(2);
    }

    @Test
    void shouldTimeOutWhenAllDriversAreLeased() {
        pool.acquire();
        pool.acquire();

        assertThatThrownBy(() -> pool.acquire()).isInstanceOf(UpstreamBlockedException.class);
        assertThat(pool.available()).isZero();
    }

    @Test
    void shouldQuitEveryDriverOnClose() {
        var leased = pool.acquire();
        var idle = pool.acquire();
        pool.release(idle, true);

        pool.close();

        then(leased).should().quit();
        then(idle).should().quit();
        assertThatThrownBy(() -> pool.acquire()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReturnPermitToPoolWhenDriverCreationFails() {
        var failing = new BrowserPool(() -> {
            throw new IllegalStateException("chrome missing");
        }, 1, Duration.ofMillis(50), Duration.ofMillis(50));

        assertThatThrownBy(failing::acquire).isInstanceOf(IllegalStateException.class);
        assertThat(failing.available()).isEqualTo(1);
    }

    private WebDriver newDriver() {
        var driver = mock(WebDriver.class);
        created.add(driver);
        return driver;
    }
}

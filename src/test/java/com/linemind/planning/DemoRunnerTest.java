package com.linemind.planning;

import com.linemind.planning.domain.Line;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@SpringBootTest(properties = {"linemind.demo.enabled=true", "linemind.forecast.seed=1"})
class DemoRunnerTest {

    @Autowired
    private DemoRunner demoRunner;

    @Test
    void seedData_coversEveryProductWithTwoLines() {
        assertThat(DemoRunner.seedLines()).hasSize(3);
        for (String product : new String[]{"ModelA", "ModelB", "ModelC"}) {
            assertThat(DemoRunner.seedLines().stream().filter(l -> l.canProduce(product))).hasSize(2);
        }
        Line first = DemoRunner.seedLines().get(0);
        assertThat(first.getEligibleProducts()).containsExactly("ModelA", "ModelB");
        assertThat(DemoRunner.seedChangeovers()).hasSize(6);
        assertThat(DemoRunner.seedHistory()).hasSize(56);
        assertThat(DemoRunner.seedWorkers()).extracting("workerId").doesNotHaveDuplicates();
    }

    @Test
    void run_completesWithConfiguredStrategies() {
        assertThatCode(() -> demoRunner.run()).doesNotThrowAnyException();
    }
}

package io.selectivetests.cli.fixture;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.fail;

public class FailingFixture {

    @Test
    void alwaysFails() {
        fail("failing on purpose");
    }
}

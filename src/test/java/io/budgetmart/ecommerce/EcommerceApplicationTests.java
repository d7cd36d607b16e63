package io.budgetmart.ecommerce;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles({"test", "inmemory"})
class EcommerceApplicationTests {

    @Test
    void contextLoads() {
    }
}

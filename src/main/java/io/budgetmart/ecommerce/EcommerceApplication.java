package io.budgetmart.ecommerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * DailyBudgetMart 멀티 테넌트 스토어 백엔드
 *
 * 기본 실행은 MongoDB(DATABASE_URL)를 사용하고,
 * inmemory 프로필로 띄우면 Mongo 없이 메모리 저장소로 동작한다.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EcommerceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EcommerceApplication.class, args);
    }
}

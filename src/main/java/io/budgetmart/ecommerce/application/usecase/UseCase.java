package io.budgetmart.ecommerce.application.usecase;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 유스케이스 빈 표시
 * <p>
 * 클래스 하나가 API 동작 하나를 맡고 진입점은 execute(...) 하나로 둔다.
 * 컨트롤러는 유스케이스만 호출하고 저장소를 직접 건드리지 않는다.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface UseCase {

    @AliasFor(annotation = Component.class)
    String value() default "";
}

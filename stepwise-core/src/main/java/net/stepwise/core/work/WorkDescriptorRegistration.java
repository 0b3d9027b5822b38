package net.stepwise.core.work;

/** 레지스트리에 올릴 (이름, 팩토리). 스프링에서는 빈으로 선언한다. */
public record WorkDescriptorRegistration(String name, WorkDescriptorFactory factory) {
}

package io.courier.middleware;

@FunctionalInterface
public interface Terminal<C extends PipelineContext> {

    void complete(C context) throws Exception;
}

package com.amqpharness.pipeline;

/**
 * An active pipeline. Closing the handle destroys every resource the pipeline created.
 */
public final class PipelineHandle<T> implements AutoCloseable {

    private final ResourcePipeline<T> pipeline;

    PipelineHandle(ResourcePipeline<T> pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Lease a resource, creating one if none is idle.
     *
     * @throws ResourceCreateException if a new resource cannot be created
     */
    public ResourceLease<T> get() {
        return pipeline.get();
    }

    public ResourcePipeline<T> getPipeline() {
        return pipeline;
    }

    @Override
    public void close() {
        pipeline.shutdown();
    }
}

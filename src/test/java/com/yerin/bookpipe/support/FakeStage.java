package com.yerin.bookpipe.support;

import com.yerin.bookpipe.application.PipelineStage;
import com.yerin.bookpipe.application.StageContext;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/** Stage whose body is supplied by the test; records every job it ran for. */
public class FakeStage implements PipelineStage {

    private final String name;
    private final BiFunction<String, StageContext, String> body;
    private final List<String> executedFor = new CopyOnWriteArrayList<>();

    public FakeStage(String name, BiFunction<String, StageContext, String> body) {
        this.name = name;
        this.body = body;
    }

    /** Returns {@code <inputRef>+<name>} so the artifact chain is visible in assertions. */
    public static FakeStage passing(String name) {
        return new FakeStage(name, (input, ctx) -> input + "+" + name);
    }

    public static FakeStage failing(String name, String message) {
        return new FakeStage(name, (input, ctx) -> {
            throw new IllegalStateException(message);
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String execute(String inputRef, StageContext context) {
        executedFor.add(context.jobId());
        return body.apply(inputRef, context);
    }

    public List<String> executedFor() {
        return executedFor;
    }

    public int executions() {
        return executedFor.size();
    }
}

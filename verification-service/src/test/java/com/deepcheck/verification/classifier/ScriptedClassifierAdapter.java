package com.deepcheck.verification.classifier;

import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.Verdict;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Test double answering every artifact through a script. */
public class ScriptedClassifierAdapter implements ClassifierAdapter {

    private final String source;
    private final Function<Artifact, Mono<Judgment>> script;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger textCalls = new AtomicInteger();
    private Function<String, Mono<String>> textScript;

    public ScriptedClassifierAdapter(String source, Function<Artifact, Mono<Judgment>> script) {
        this.source = source;
        this.script = script;
    }

    public static ScriptedClassifierAdapter answering(String source, Verdict verdict, double confidence) {
        return new ScriptedClassifierAdapter(source,
            artifact -> Mono.just(judgment(source, verdict, confidence)));
    }

    public static ScriptedClassifierAdapter failing(String source, RuntimeException error) {
        return new ScriptedClassifierAdapter(source, artifact -> Mono.error(error));
    }

    public static ScriptedClassifierAdapter delayed(String source, Duration delay, Verdict verdict, double confidence) {
        return new ScriptedClassifierAdapter(source,
            artifact -> Mono.delay(delay).thenReturn(judgment(source, verdict, confidence)));
    }

    public static Judgment judgment(String source, Verdict verdict, double confidence) {
        return Judgment.of(source, verdict, confidence, source + " says " + verdict, List.of());
    }

    /** Lets this double answer {@link #generateText} prompts as well. */
    public ScriptedClassifierAdapter answeringText(Function<String, Mono<String>> textScript) {
        this.textScript = textScript;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public int textCalls() {
        return textCalls.get();
    }

    @Override
    public String sourceName() {
        return source;
    }

    @Override
    public Mono<Judgment> evaluate(Artifact artifact) {
        calls.incrementAndGet();
        return script.apply(artifact);
    }

    @Override
    public Mono<String> generateText(String prompt) {
        textCalls.incrementAndGet();
        return textScript == null ? ClassifierAdapter.super.generateText(prompt) : textScript.apply(prompt);
    }
}

package com.equationforge.generator;

@FunctionalInterface
public interface EquationSink {

    void accept(String equation);
}

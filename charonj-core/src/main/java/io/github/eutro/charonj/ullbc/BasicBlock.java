package io.github.eutro.charonj.ullbc;

import io.github.eutro.charonj.ext.ExtHolder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A basic block: a list of statements, then a terminator.
 * <p>
 * Blocks are addressed by their index in {@link UllbcBody#blocks}.
 */
public class BasicBlock extends ExtHolder {
    public final List<Statement> statements;
    private Terminator terminator;

    public BasicBlock(List<Statement> statements, Terminator terminator) {
        this.statements = new ArrayList<>(statements);
        this.terminator = terminator;
    }

    public Terminator getTerminator() {
        return terminator;
    }

    public void setTerminator(Terminator terminator) {
        this.terminator = terminator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BasicBlock that = (BasicBlock) o;
        return statements.equals(that.statements) && terminator.equals(that.terminator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statements, terminator);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{\n");
        for (Statement statement : statements) {
            sb.append("  ").append(statement).append(";\n");
        }
        return sb.append("  ").append(terminator).append(";\n}").toString();
    }
}

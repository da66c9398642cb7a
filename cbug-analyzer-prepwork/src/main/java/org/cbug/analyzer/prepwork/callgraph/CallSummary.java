package org.cbug.analyzer.prepwork.callgraph;

/*
what a function defined in the translation unit does to memory, one level deep:
allocator: returns memory it allocated itself; freedParameter: index of the parameter it frees, or -1
 */
public record CallSummary(String function, boolean allocator, int freedParameter) {

    public boolean isDeallocator() {
        return freedParameter >= 0;
    }
}

package org.calista.branchgraph.text;

import java.util.List;

public interface Tokenizer {
    List<String> tokenize(String text);
}

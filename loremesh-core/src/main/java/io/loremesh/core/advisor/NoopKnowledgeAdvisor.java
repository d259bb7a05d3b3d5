package io.loremesh.core.advisor;

public final class NoopKnowledgeAdvisor implements KnowledgeAdvisor {

    @Override
    public String query(String text) {
        return "";
    }

    @Override
    public void store(LearningRecord record) {
    }

    @Override
    public String chat(String message) {
        return "";
    }
}

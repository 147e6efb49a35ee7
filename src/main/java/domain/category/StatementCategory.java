package domain.category;

import domain.model.StatementSignature;
import domain.text.SourceStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statements sharing one signature, in input order.
 */
public final class StatementCategory {

    private final int number;
    private final StatementSignature signature;
    private final List<SourceStatement> members = new ArrayList<>();

    StatementCategory(int number, StatementSignature signature) {
        this.number = number;
        this.signature = signature;
    }

    void add(SourceStatement member) {
        members.add(member);
    }

    /** 1-based, in order of first appearance. */
    public int getNumber() {
        return number;
    }

    public StatementSignature getSignature() {
        return signature;
    }

    public List<SourceStatement> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public int size() {
        return members.size();
    }
}

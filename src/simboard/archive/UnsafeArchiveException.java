package simboard.archive;

public class UnsafeArchiveException extends ArchiveRejectedException {

    public enum Reason {
        PATH_TRAVERSAL,
        UNSAFE_MEMBER_TYPE
    }

    private final Reason reason;
    private final String memberName;

    public UnsafeArchiveException(Reason reason, String memberName, String message) {
        super(message);
        this.reason = reason;
        this.memberName = memberName;
    }

    public Reason getReason() {
        return reason;
    }

    public String getMemberName() {
        return memberName;
    }
}

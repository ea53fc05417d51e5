package dk.trustworks.leaveledger.exceptions;

public class RecordNotFoundException extends LeaveLedgerException {

    public RecordNotFoundException(String message) {
        super(ErrorType.NOT_FOUND, message);
    }

    public static RecordNotFoundException of(String type, String uuid) {
        return new RecordNotFoundException(type + " " + uuid + " not found");
    }
}

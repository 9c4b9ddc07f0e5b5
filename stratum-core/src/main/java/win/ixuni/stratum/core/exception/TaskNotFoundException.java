package win.ixuni.stratum.core.exception;

/**
 * Migration task (or batch) not found exception
 */
public class TaskNotFoundException extends NotFoundException {

    public TaskNotFoundException(String taskId) {
        super("migration task", taskId);
    }

    protected TaskNotFoundException(String resourceType, String id) {
        super(resourceType, id);
    }

    public static TaskNotFoundException batch(String batchId) {
        return new TaskNotFoundException("migration batch", batchId);
    }
}

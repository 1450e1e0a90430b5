package proto.runtime;

/**
 * 消息链求值时，消息名在接收者及其所有可达祖先中都找不到。
 *
 * <p>整条消息链随即中止，不返回任何中间结果。</p>
 */
public class MessageNotFoundException extends ProtoException {

    private final String messageName;

    public MessageNotFoundException(String messageName) {
        super("Message '" + messageName + "' not found");
        this.messageName = messageName;
    }

    /** 未找到的消息名 */
    public String getMessageName() {
        return messageName;
    }
}

package proto.runtime;

/**
 * ProtoLang 基础运行时异常。
 *
 * <p>求值过程中的契约违规（原生计算返回 null、超出求值深度等）直接抛出此类；
 * 消息链查找失败使用子类 {@link MessageNotFoundException}。</p>
 */
public class ProtoException extends RuntimeException {

    public ProtoException(String message) {
        super(message);
    }

    public ProtoException(String message, Throwable cause) {
        super(message, cause);
    }
}

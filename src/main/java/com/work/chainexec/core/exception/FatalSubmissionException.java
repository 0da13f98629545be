package com.work.chainexec.core.exception;

/**
 * 不可恢复的提交失败（余额不足、revert、非法指令），首次出现即终止重试。
 */
public class FatalSubmissionException extends ChainExecException {

    public FatalSubmissionException(String message) {
        super(message);
    }

    public FatalSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.whereq.orchestra.notification;

/**
 * Channel naming: {@code job:<id>}, {@code execution:<id>}, {@code playbook:<id>}
 */
public final class Channels {

    private Channels() {
    }

    public static String job(String jobId) {
        return "job:" + jobId;
    }

    public static String execution(String executionId) {
        return "execution:" + executionId;
    }

    public static String playbook(String playbookId) {
        return "playbook:" + playbookId;
    }
}

package com.sds.phucth.assistantrelay.consts;

public interface ReplyConstants {
    interface Field {
        String REPLY = "reply";
        String END_CHAT = "end_chat";
        String NEED = "need";
        String NEED_INTAKE = "need_intake";
        String BACK_TO_INTAKE = "back_to_intake";
        String ERROR = "error";
        String STATUS = "status";
    }

    interface Value {
        String NEED_YES = "yes";
        String NEED_NO = "no";
        String STATUS_OK = "ok";
    }

    interface Apology {
        String TECHNICAL = "Lo siento, hay un problema técnico. Por favor, inténtalo de nuevo.";
        String UNEXPECTED = "Ha ocurrido un error inesperado. Por favor, inténtalo de nuevo.";
    }
}

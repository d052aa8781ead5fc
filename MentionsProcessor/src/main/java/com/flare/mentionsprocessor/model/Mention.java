package com.flare.mentionsprocessor.model;

import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdGenerator;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

/**
 * ActiveJDBC Model for the mentions table
 */
@Table("mentions")
@IdName("id")
@IdGenerator("nextval('s_mentions')")
public class Mention extends Model {
}

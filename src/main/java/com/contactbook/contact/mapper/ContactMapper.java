package com.contactbook.contact.mapper;

import com.contactbook.contact.domain.Contact;
import com.contactbook.contact.domain.ContactField;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 联系人数据访问。每条语句都带 owner_id 条件。
 */
@Mapper
public interface ContactMapper {

    List<Contact> findByOwner(@Param("ownerId") Long ownerId);

    Contact findByIdAndOwner(@Param("id") Long id, @Param("ownerId") Long ownerId);

    /**
     * 按白名单字段等值检索。
     * @param field 已校验的字段，决定比较的列
     * @param value 已按字段类型解析的值
     */
    List<Contact> findByOwnerAndField(@Param("ownerId") Long ownerId,
                                      @Param("field") ContactField field,
                                      @Param("value") Object value);

    void insert(Contact contact);

    /**
     * 整体替换可变字段。
     * @return 影响行数，0 表示不存在或不属于该用户
     */
    int update(Contact contact);

    int deleteByIdAndOwner(@Param("id") Long id, @Param("ownerId") Long ownerId);
}
